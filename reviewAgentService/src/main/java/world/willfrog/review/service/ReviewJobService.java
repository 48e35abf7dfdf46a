package world.willfrog.review.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import world.willfrog.review.progress.ProgressStore;
import world.willfrog.review.workflow.ReviewRunRequest;
import world.willfrog.review.workflow.WorkflowResult;

import java.util.UUID;

/**
 * 审查任务入口：提交、同步执行、取消。
 * <p>
 * 以相同 reviewId 重新提交即从上次中断处恢复。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReviewJobService {

    /** 异步执行器。 */
    private final ReviewRunExecutor runExecutor;
    /** 取消信号写入。 */
    private final ProgressStore progressStore;

    public String submit(String reviewId, String applicationRef) {
        ReviewRunRequest request = request(reviewId, applicationRef);
        log.info("Review submitted: runId={}, applicationRef={}", request.runId(), applicationRef);
        runExecutor.executeAsync(request);
        return request.runId();
    }

    public WorkflowResult runNow(String reviewId, String applicationRef) {
        return runExecutor.execute(request(reviewId, applicationRef));
    }

    public boolean cancel(String reviewId) {
        boolean requested = progressStore.requestCancellation(reviewId);
        log.info("Review cancellation requested: runId={}, accepted={}", reviewId, requested);
        return requested;
    }

    private ReviewRunRequest request(String reviewId, String applicationRef) {
        if (applicationRef == null || applicationRef.isBlank()) {
            throw new IllegalArgumentException("applicationRef is required");
        }
        String runId = reviewId == null || reviewId.isBlank()
                ? "rev_" + UUID.randomUUID().toString().replace("-", "")
                : reviewId;
        return new ReviewRunRequest(runId, applicationRef.trim());
    }
}
