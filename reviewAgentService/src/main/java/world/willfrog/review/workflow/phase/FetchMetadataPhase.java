package world.willfrog.review.workflow.phase;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import world.willfrog.review.config.WorkflowProperties;
import world.willfrog.review.mcp.McpConnectionException;
import world.willfrog.review.mcp.McpToolException;
import world.willfrog.review.mcp.ToolCallResult;
import world.willfrog.review.mcp.ToolInvoker;
import world.willfrog.review.workflow.ErrorMessageExtractor;
import world.willfrog.review.workflow.PhaseExecution;
import world.willfrog.review.workflow.PhaseHandler;
import world.willfrog.review.workflow.PhaseOutcome;
import world.willfrog.review.workflow.ReviewPhase;
import world.willfrog.review.workflow.ReviewRunContext;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 获取申请元数据与文档清单。
 * <p>
 * server 不可达时降级继续（后续阶段没有文档可处理）；工具返回 error 或调用失败则终止。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FetchMetadataPhase implements PhaseHandler {

    static final String TOOL = "get_application_details";

    private final ToolInvoker toolInvoker;
    private final WorkflowProperties workflowProperties;

    @Override
    public ReviewPhase phase() {
        return ReviewPhase.FETCHING_METADATA;
    }

    @Override
    @SuppressWarnings("unchecked")
    public PhaseOutcome execute(PhaseExecution execution) {
        ReviewRunContext context = execution.context();
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("reference", context.getApplicationRef());
        ToolCallResult result;
        try {
            result = toolInvoker.invoke(TOOL, args,
                    Duration.ofMillis(workflowProperties.getTimeouts().getFetchMetadataMs()));
        } catch (McpConnectionException e) {
            return PhaseOutcome.recoverable("Application metadata unavailable: " + e.getMessage());
        } catch (McpToolException e) {
            return PhaseOutcome.fatal("Failed to fetch application: " + ErrorMessageExtractor.describe(e));
        }

        Map<String, Object> payload = result.getPayload();
        if (PayloadValues.reportsError(payload)) {
            return PhaseOutcome.fatal("Failed to fetch application: " + ErrorMessageExtractor.extract(payload));
        }
        Map<String, Object> application = payload.get("application") instanceof Map<?, ?> nested
                ? new LinkedHashMap<>((Map<String, Object>) nested)
                : new LinkedHashMap<>(payload);
        List<Map<String, Object>> documents = PayloadValues.maps(application.remove("documents"));
        application.remove("status");

        context.setMetadata(application);
        context.setDocuments(documents);
        context.setSelectedDocuments(new ArrayList<>(documents));
        execution.reportProgress("Found " + documents.size() + " documents", 1, 1);
        log.info("Application metadata fetched: applicationRef={}, documents={}", context.getApplicationRef(), documents.size());
        return PhaseOutcome.success();
    }
}
