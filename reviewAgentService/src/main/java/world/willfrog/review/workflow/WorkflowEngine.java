package world.willfrog.review.workflow;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import world.willfrog.review.config.WorkflowProperties;
import world.willfrog.review.context.ReviewContext;
import world.willfrog.review.progress.ProgressStore;
import world.willfrog.review.progress.ProgressTracker;
import world.willfrog.review.progress.StateRecoveryException;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Optional;

/**
 * 审查流程状态机。
 * <p>
 * 职责：
 * 1. 加载持久化状态，从上次中断的阶段恢复执行；
 * 2. 阶段之间检查取消信号；
 * 3. 按 {@link PhaseOutcome#isRecoverable()} 决定降级继续或终止；
 * 4. 结束时发布终态事件，成功则删除持久化状态。
 * <p>
 * 恢复规则：恢复点之前、已在 completedPhases 中的阶段被跳过；到达恢复点之后的阶段全部重新执行。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkflowEngine {

    /** 阶段序列。 */
    private final ReviewPipeline pipeline;
    /** 状态与进度存储。 */
    private final ProgressStore progressStore;
    /** 阶段内 fan-out。 */
    private final FanOutExecutor fanOutExecutor;
    private final WorkflowProperties workflowProperties;

    /**
     * 执行（或恢复）一次审查。不抛异常，结果通过 {@link WorkflowResult#getStatus()} 区分。
     */
    public WorkflowResult run(ReviewRunRequest request) {
        if (request == null || request.runId() == null || request.runId().isBlank()) {
            throw new IllegalArgumentException("runId is required");
        }
        ReviewContext.setRunId(request.runId());
        Instant started = Instant.now();
        try {
            return execute(request);
        } catch (RuntimeException e) {
            log.error("Review run aborted by unexpected error: runId={}", request.runId(), e);
            return WorkflowResult.builder()
                    .runId(request.runId())
                    .subjectId(request.applicationRef())
                    .status(RunStatus.FAILED)
                    .error("Unexpected error: " + ErrorMessageExtractor.describe(e))
                    .durationSeconds(Duration.between(started, Instant.now()).toMillis() / 1000.0)
                    .build();
        } finally {
            ReviewContext.clear();
        }
    }

    private WorkflowResult execute(ReviewRunRequest request) {
        WorkflowState state = loadOrCreate(request);
        boolean resumed = !state.getCompletedPhases().isEmpty() || state.getCurrentPhase() != null;
        ProgressTracker tracker = progressStore.tracker(state);
        tracker.startWorkflow(resumed);

        ReviewPhase resumePoint = resumePoint(state);
        boolean reached = false;
        for (PhaseDescriptor descriptor : pipeline.phases()) {
            ReviewPhase phase = descriptor.phase();
            if (!reached && phase != resumePoint && state.isCompleted(phase)) {
                log.info("Skipping completed phase: runId={}, phase={}", state.getRunId(), phase.getValue());
                continue;
            }
            reached = true;

            if (progressStore.checkCancellation(state)) {
                tracker.cancelWorkflow();
                return result(state, RunStatus.CANCELLED, WorkflowResult.CANCELLED_ERROR, null);
            }

            ReviewContext.setPhase(phase.getValue());
            tracker.startPhase(phase);
            PhaseOutcome outcome = runHandler(descriptor, state, tracker);
            tracker.setItemCounts(outcome.getItemsProcessed(), outcome.getItemsTotal());
            tracker.recordItemErrors(phase, outcome.getItemErrors());

            if (outcome.isSuccess()) {
                continue;
            }
            if (outcome.isRecoverable()) {
                log.warn("Phase failed, continuing degraded: runId={}, phase={}, error={}",
                        state.getRunId(), phase.getValue(), outcome.getError());
                tracker.recordPhaseError(phase, outcome.getError());
                continue;
            }
            tracker.failPhase(phase, outcome.getError());
            tracker.failWorkflow(outcome.getError());
            return result(state, RunStatus.FAILED, outcome.getError(), phase);
        }

        tracker.completeWorkflow();
        return result(state, RunStatus.COMPLETED, null, null);
    }

    private PhaseOutcome runHandler(PhaseDescriptor descriptor, WorkflowState state, ProgressTracker tracker) {
        ReviewPhase phase = descriptor.phase();
        PhaseExecution execution = new PhaseExecution(state.getRunId(), phase, state.getContext(), tracker,
                fanOutExecutor, workflowProperties.getFanOut().getConcurrency());
        try {
            PhaseOutcome outcome = descriptor.handler().execute(execution);
            return outcome == null ? PhaseOutcome.fatal("Phase " + phase.getValue() + " returned no outcome") : outcome;
        } catch (RuntimeException e) {
            log.error("Phase handler raised unexpected error: runId={}, phase={}", state.getRunId(), phase.getValue(), e);
            return PhaseOutcome.fatal("Unexpected error in " + phase.getValue() + ": " + ErrorMessageExtractor.describe(e));
        }
    }

    private WorkflowState loadOrCreate(ReviewRunRequest request) {
        try {
            Optional<WorkflowState> existing = progressStore.loadState(request.runId());
            if (existing.isPresent()) {
                WorkflowState state = existing.get();
                normalize(state, request);
                log.info("Resuming review run: runId={}, completedPhases={}, currentPhase={}",
                        state.getRunId(), state.getCompletedPhases(), state.getCurrentPhase());
                return state;
            }
        } catch (StateRecoveryException e) {
            log.warn("Discarding unrecoverable workflow state, starting fresh: runId={}, error={}",
                    request.runId(), e.getMessage());
        }
        return WorkflowState.builder()
                .runId(request.runId())
                .subjectId(request.applicationRef())
                .startedAt(Instant.now())
                .context(ReviewRunContext.builder().applicationRef(request.applicationRef()).build())
                .build();
    }

    private void normalize(WorkflowState state, ReviewRunRequest request) {
        state.setRunId(request.runId());
        if (state.getSubjectId() == null) {
            state.setSubjectId(request.applicationRef());
        }
        if (state.getCompletedPhases() == null) {
            state.setCompletedPhases(new ArrayList<>());
        }
        if (state.getContext() == null) {
            state.setContext(new ReviewRunContext());
        }
        if (state.getContext().getApplicationRef() == null) {
            state.getContext().setApplicationRef(state.getSubjectId());
        }
        // 只以当前的 cancel key 为准
        state.setCancelled(false);
    }

    /**
     * 持久化的 currentPhase 未完成时从它恢复，否则从第一个未完成的阶段恢复。
     */
    private ReviewPhase resumePoint(WorkflowState state) {
        ReviewPhase current = state.getCurrentPhase();
        if (current != null && !state.isCompleted(current)) {
            return current;
        }
        for (PhaseDescriptor descriptor : pipeline.phases()) {
            if (!state.isCompleted(descriptor.phase())) {
                return descriptor.phase();
            }
        }
        return null;
    }

    private WorkflowResult result(WorkflowState state, RunStatus status, String error, ReviewPhase failedPhase) {
        return WorkflowResult.builder()
                .runId(state.getRunId())
                .subjectId(state.getSubjectId())
                .status(status)
                .error(error)
                .failedPhase(failedPhase)
                .completedPhases(new ArrayList<>(state.getCompletedPhases()))
                .errors(new ArrayList<>(state.getErrorsEncountered()))
                .context(state.getContext())
                .durationSeconds(state.getStartedAt() == null
                        ? 0.0
                        : Duration.between(state.getStartedAt(), Instant.now()).toMillis() / 1000.0)
                .build();
    }
}
