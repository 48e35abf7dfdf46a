package world.willfrog.review.content;

import java.util.List;
import java.util.Map;

/**
 * 决定哪些申请文档需要下载。
 */
public interface DocumentFilter {

    DocumentFilterResult filter(String applicationRef, List<Map<String, Object>> documents);
}
