package world.willfrog.review.workflow;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 各阶段累积的产出，随 {@link WorkflowState} 一起持久化，恢复执行时跳过的阶段产出仍可用。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReviewRunContext {
    private String applicationRef;
    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();
    /** 元数据中列出的全部文档。 */
    @Builder.Default
    private List<Map<String, Object>> documents = new ArrayList<>();
    /** 过滤后需要下载的文档。 */
    @Builder.Default
    private List<Map<String, Object>> selectedDocuments = new ArrayList<>();
    @Builder.Default
    private List<Map<String, Object>> filteredOutDocuments = new ArrayList<>();
    @Builder.Default
    private List<String> downloadedPaths = new ArrayList<>();
    @Builder.Default
    private List<String> ingestedDocuments = new ArrayList<>();
    /** 主题 -> 检索证据。 */
    @Builder.Default
    private Map<String, Object> evidence = new LinkedHashMap<>();
    @Builder.Default
    private Map<String, Object> review = new LinkedHashMap<>();
    @Builder.Default
    private Map<String, Object> verification = new LinkedHashMap<>();
    private boolean verified;
}
