package world.willfrog.review.workflow.phase;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import world.willfrog.review.config.WorkflowProperties;
import world.willfrog.review.mcp.ToolCallResult;
import world.willfrog.review.mcp.ToolInvoker;
import world.willfrog.review.workflow.ErrorMessageExtractor;
import world.willfrog.review.workflow.FanOutResult;
import world.willfrog.review.workflow.ItemOutcome;
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
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 把下载的文档逐个写入文档库（有界并发）。
 * <p>
 * status 为 success / already_ingested 视为成功，skipped 视为跳过；没有任何文档写入成功时终止。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class IngestDocumentsPhase implements PhaseHandler {

    static final String TOOL = "ingest_document";

    private final ToolInvoker toolInvoker;
    private final WorkflowProperties workflowProperties;

    @Override
    public ReviewPhase phase() {
        return ReviewPhase.INGESTING_DOCUMENTS;
    }

    @Override
    public PhaseOutcome execute(PhaseExecution execution) {
        ReviewRunContext context = execution.context();
        List<String> paths = context.getDownloadedPaths();
        if (paths.isEmpty()) {
            context.setIngestedDocuments(new ArrayList<>());
            return PhaseOutcome.success(0, 0, List.of());
        }
        Duration timeout = Duration.ofMillis(workflowProperties.getTimeouts().getIngestMs());
        Set<String> ingested = ConcurrentHashMap.newKeySet();

        FanOutResult result = execution.fanOut(paths, "Ingesting document", PayloadValues::fileName, path -> {
            Map<String, Object> args = new LinkedHashMap<>();
            args.put("file_path", path);
            args.put("application_ref", context.getApplicationRef());
            ToolCallResult call = toolInvoker.invoke(TOOL, args, timeout);
            String status = call.getString("status");
            if ("success".equals(status) || "already_ingested".equals(status)) {
                ingested.add(path);
                return ItemOutcome.SUCCEEDED;
            }
            if ("skipped".equals(status)) {
                return ItemOutcome.SKIPPED;
            }
            throw new ItemFailedException(ErrorMessageExtractor.extract(call.getPayload()));
        });

        List<String> ordered = new ArrayList<>();
        for (String path : paths) {
            if (ingested.contains(path)) {
                ordered.add(path);
            }
        }
        context.setIngestedDocuments(ordered);
        log.info("Documents ingested: applicationRef={}, succeeded={}, failed={}, skipped={}",
                context.getApplicationRef(), result.succeeded(), result.failed(), result.skipped());
        if (result.noneSucceeded()) {
            return PhaseOutcome.fatal("No documents could be ingested (" + result.failed() + " failed, " + result.skipped() + " skipped)",
                    result.succeeded(), result.total(), result.errors());
        }
        return PhaseOutcome.success(result.succeeded(), result.total(), result.errors());
    }
}
