package world.willfrog.review.content;

import java.util.List;
import java.util.Map;

/**
 * @param selected    需要下载的文档
 * @param filteredOut 被过滤的文档，附带 filter_reason
 */
public record DocumentFilterResult(List<Map<String, Object>> selected, List<Map<String, Object>> filteredOut) {
}
