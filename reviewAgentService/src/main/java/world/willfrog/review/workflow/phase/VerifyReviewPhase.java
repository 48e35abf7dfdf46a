package world.willfrog.review.workflow.phase;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import world.willfrog.review.content.ReviewVerifier;
import world.willfrog.review.workflow.ErrorMessageExtractor;
import world.willfrog.review.workflow.PhaseExecution;
import world.willfrog.review.workflow.PhaseHandler;
import world.willfrog.review.workflow.PhaseOutcome;
import world.willfrog.review.workflow.ReviewPhase;
import world.willfrog.review.workflow.ReviewRunContext;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 校验生成的审查。校验失败不影响已生成的审查，只标记为未校验。
 * <p>
 * 校验发现的问题只写入 context.verification，不计入 run 的错误记录。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class VerifyReviewPhase implements PhaseHandler {

    private final ReviewVerifier reviewVerifier;

    @Override
    public ReviewPhase phase() {
        return ReviewPhase.VERIFYING_REVIEW;
    }

    @Override
    public PhaseOutcome execute(PhaseExecution execution) {
        ReviewRunContext context = execution.context();
        ReviewVerifier.Verification verification;
        try {
            verification = reviewVerifier.verify(context);
        } catch (RuntimeException e) {
            log.warn("Review verification failed: runId={}, error={}", execution.runId(), e.getMessage());
            context.setVerified(false);
            return PhaseOutcome.recoverable("Review verification failed: " + ErrorMessageExtractor.describe(e));
        }
        List<String> issues = verification.issues() == null ? List.of() : verification.issues();
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("verified", verification.verified());
        summary.put("issues", new ArrayList<>(issues));
        context.setVerification(summary);
        context.setVerified(verification.verified());
        if (!issues.isEmpty()) {
            log.info("Review verification found issues: runId={}, issues={}", execution.runId(), issues.size());
        }
        execution.reportProgress("Review verified", 1, 1);
        return PhaseOutcome.success();
    }
}
