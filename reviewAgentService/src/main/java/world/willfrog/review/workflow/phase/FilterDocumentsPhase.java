package world.willfrog.review.workflow.phase;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import world.willfrog.review.config.WorkflowProperties;
import world.willfrog.review.content.DocumentFilter;
import world.willfrog.review.content.DocumentFilterResult;
import world.willfrog.review.workflow.ErrorMessageExtractor;
import world.willfrog.review.workflow.PhaseExecution;
import world.willfrog.review.workflow.PhaseHandler;
import world.willfrog.review.workflow.PhaseOutcome;
import world.willfrog.review.workflow.ReviewPhase;
import world.willfrog.review.workflow.ReviewRunContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 选择需要下载的文档。过滤器失败时保留全部文档并降级继续。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FilterDocumentsPhase implements PhaseHandler {

    private final DocumentFilter documentFilter;
    private final WorkflowProperties workflowProperties;

    @Override
    public ReviewPhase phase() {
        return ReviewPhase.FILTERING_DOCUMENTS;
    }

    @Override
    public PhaseOutcome execute(PhaseExecution execution) {
        ReviewRunContext context = execution.context();
        List<Map<String, Object>> documents = context.getDocuments();
        if (workflowProperties.isSkipFilter() || documents.isEmpty()) {
            context.setSelectedDocuments(new ArrayList<>(documents));
            return PhaseOutcome.success(documents.size(), documents.size(), List.of());
        }
        try {
            DocumentFilterResult result = documentFilter.filter(context.getApplicationRef(), documents);
            context.setSelectedDocuments(new ArrayList<>(result.selected()));
            context.setFilteredOutDocuments(new ArrayList<>(result.filteredOut()));
            execution.reportProgress("Selected " + result.selected().size() + " of " + documents.size() + " documents",
                    documents.size(), documents.size());
            return PhaseOutcome.success(result.selected().size(), documents.size(), List.of());
        } catch (RuntimeException e) {
            log.warn("Document filter failed, keeping all documents: applicationRef={}, error={}",
                    context.getApplicationRef(), e.getMessage());
            context.setSelectedDocuments(new ArrayList<>(documents));
            context.setFilteredOutDocuments(new ArrayList<>());
            return PhaseOutcome.recoverable("Document filter failed, keeping all documents: "
                    + ErrorMessageExtractor.describe(e));
        }
    }
}
