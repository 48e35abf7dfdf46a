package world.willfrog.review.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import world.willfrog.review.workflow.ReviewRunRequest;
import world.willfrog.review.workflow.WorkflowEngine;
import world.willfrog.review.workflow.WorkflowResult;

@Service
@RequiredArgsConstructor
@Slf4j
public class ReviewRunExecutor {

    private final WorkflowEngine workflowEngine;

    /**
     * 异步执行审查 run。
     *
     * @param request run 请求
     */
    @Async
    public void executeAsync(ReviewRunRequest request) {
        try {
            execute(request);
        } catch (Exception e) {
            log.error("Review run execute failed: runId={}", request.runId(), e);
        }
    }

    public WorkflowResult execute(ReviewRunRequest request) {
        WorkflowResult result = workflowEngine.run(request);
        switch (result.getStatus()) {
            case COMPLETED -> log.info("Review run finished: runId={}, durationSeconds={}, errors={}",
                    result.getRunId(), result.getDurationSeconds(), result.getErrors().size());
            case CANCELLED -> log.info("Review run cancelled: runId={}, completedPhases={}",
                    result.getRunId(), result.getCompletedPhases());
            case FAILED -> log.warn("Review run failed: runId={}, phase={}, error={}",
                    result.getRunId(), result.getFailedPhase(), result.getError());
        }
        return result;
    }
}
