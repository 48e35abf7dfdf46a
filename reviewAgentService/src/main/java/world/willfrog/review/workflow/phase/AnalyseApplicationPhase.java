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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 按主题检索申请文档与政策库，收集分析证据。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AnalyseApplicationPhase implements PhaseHandler {

    static final String APPLICATION_SEARCH_TOOL = "search_application_docs";
    static final String POLICY_SEARCH_TOOL = "search_policy";

    private final ToolInvoker toolInvoker;
    private final WorkflowProperties workflowProperties;

    @Override
    public ReviewPhase phase() {
        return ReviewPhase.ANALYSING_APPLICATION;
    }

    @Override
    public PhaseOutcome execute(PhaseExecution execution) {
        ReviewRunContext context = execution.context();
        List<String> topics = workflowProperties.getAnalysis().getTopics();
        if (topics == null || topics.isEmpty()) {
            return PhaseOutcome.success(0, 0, List.of());
        }
        int maxResults = workflowProperties.getAnalysis().getMaxResults();
        Duration timeout = Duration.ofMillis(workflowProperties.getTimeouts().getSearchMs());
        Map<String, Object> collected = new ConcurrentHashMap<>();

        FanOutResult result = execution.fanOut(topics, "Analysing topic", topic -> topic, topic -> {
            Map<String, Object> applicationArgs = new LinkedHashMap<>();
            applicationArgs.put("query", topic);
            applicationArgs.put("application_ref", context.getApplicationRef());
            applicationArgs.put("max_results", maxResults);
            ToolCallResult applicationHits = checked(toolInvoker.invoke(APPLICATION_SEARCH_TOOL, applicationArgs, timeout));

            Map<String, Object> policyArgs = new LinkedHashMap<>();
            policyArgs.put("query", topic);
            policyArgs.put("n_results", maxResults);
            ToolCallResult policyHits = checked(toolInvoker.invoke(POLICY_SEARCH_TOOL, policyArgs, timeout));

            Map<String, Object> evidence = new LinkedHashMap<>();
            evidence.put("application_results", PayloadValues.list(applicationHits.get("results")));
            evidence.put("policy_results", PayloadValues.list(policyHits.get("results")));
            collected.put(topic, evidence);
            return ItemOutcome.SUCCEEDED;
        });

        Map<String, Object> evidence = new LinkedHashMap<>();
        for (String topic : topics) {
            if (collected.containsKey(topic)) {
                evidence.put(topic, collected.get(topic));
            }
        }
        context.setEvidence(evidence);
        log.info("Application analysed: applicationRef={}, topics={}, failed={}",
                context.getApplicationRef(), result.succeeded(), result.failed());
        if (result.noneSucceeded()) {
            return PhaseOutcome.fatal("Analysis failed for every topic (" + result.failed() + " failed)",
                    result.succeeded(), result.total(), result.errors());
        }
        return PhaseOutcome.success(result.succeeded(), result.total(), result.errors());
    }

    private ToolCallResult checked(ToolCallResult result) {
        if (PayloadValues.reportsError(result.getPayload())) {
            throw new ItemFailedException(ErrorMessageExtractor.extract(result.getPayload()));
        }
        return result;
    }
}
