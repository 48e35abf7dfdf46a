package world.willfrog.review.workflow.phase;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import world.willfrog.review.content.ReviewGenerator;
import world.willfrog.review.workflow.ErrorMessageExtractor;
import world.willfrog.review.workflow.PhaseExecution;
import world.willfrog.review.workflow.PhaseHandler;
import world.willfrog.review.workflow.PhaseOutcome;
import world.willfrog.review.workflow.ReviewPhase;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
@RequiredArgsConstructor
@Slf4j
public class GenerateReviewPhase implements PhaseHandler {

    private final ReviewGenerator reviewGenerator;

    @Override
    public ReviewPhase phase() {
        return ReviewPhase.GENERATING_REVIEW;
    }

    @Override
    public PhaseOutcome execute(PhaseExecution execution) {
        try {
            Map<String, Object> review = reviewGenerator.generate(execution.context());
            execution.context().setReview(review == null ? new LinkedHashMap<>() : new LinkedHashMap<>(review));
            execution.reportProgress("Review generated", 1, 1);
            return PhaseOutcome.success();
        } catch (RuntimeException e) {
            log.warn("Review generation failed: runId={}, error={}", execution.runId(), e.getMessage());
            return PhaseOutcome.fatal("Review generation failed: " + ErrorMessageExtractor.describe(e));
        }
    }
}
