package world.willfrog.review.workflow.phase;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import world.willfrog.review.config.WorkflowProperties;
import world.willfrog.review.mcp.McpException;
import world.willfrog.review.mcp.ToolCallResult;
import world.willfrog.review.mcp.ToolInvoker;
import world.willfrog.review.workflow.ErrorMessageExtractor;
import world.willfrog.review.workflow.ItemError;
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
 * 一次调用下载全部已选文档，单个文档的下载失败记为条目错误。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DownloadDocumentsPhase implements PhaseHandler {

    static final String TOOL = "download_all_documents";

    private final ToolInvoker toolInvoker;
    private final WorkflowProperties workflowProperties;

    @Override
    public ReviewPhase phase() {
        return ReviewPhase.DOWNLOADING_DOCUMENTS;
    }

    @Override
    public PhaseOutcome execute(PhaseExecution execution) {
        ReviewRunContext context = execution.context();
        List<Map<String, Object>> selected = context.getSelectedDocuments();
        if (selected.isEmpty()) {
            context.setDownloadedPaths(new ArrayList<>());
            return PhaseOutcome.success(0, 0, List.of());
        }
        execution.reportProgress("Downloading " + selected.size() + " documents", 0, selected.size());

        Map<String, Object> args = new LinkedHashMap<>();
        args.put("reference", context.getApplicationRef());
        args.put("document_list", selected);
        ToolCallResult result;
        try {
            result = toolInvoker.invoke(TOOL, args, Duration.ofMillis(workflowProperties.getTimeouts().getDownloadMs()));
        } catch (McpException e) {
            return PhaseOutcome.fatal("Failed to download documents: " + ErrorMessageExtractor.describe(e));
        }
        if (PayloadValues.reportsError(result.getPayload())) {
            return PhaseOutcome.fatal("Failed to download documents: " + ErrorMessageExtractor.extract(result.getPayload()));
        }

        List<String> paths = new ArrayList<>();
        for (Map<String, Object> downloaded : PayloadValues.maps(result.get("downloaded"))) {
            Object path = downloaded.get("path");
            if (path != null && !String.valueOf(path).isBlank()) {
                paths.add(String.valueOf(path));
            }
        }
        List<ItemError> itemErrors = new ArrayList<>();
        for (Map<String, Object> failed : PayloadValues.maps(result.get("failed"))) {
            itemErrors.add(new ItemError(PayloadValues.label(failed), ErrorMessageExtractor.extract(failed)));
        }
        context.setDownloadedPaths(paths);
        execution.reportProgress("Downloaded " + paths.size() + " of " + selected.size() + " documents",
                selected.size(), selected.size());
        log.info("Documents downloaded: applicationRef={}, downloaded={}, failed={}",
                context.getApplicationRef(), paths.size(), itemErrors.size());
        return PhaseOutcome.success(paths.size(), selected.size(), itemErrors);
    }
}
