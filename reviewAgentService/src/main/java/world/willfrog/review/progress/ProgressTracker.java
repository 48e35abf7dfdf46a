package world.willfrog.review.progress;

import lombok.extern.slf4j.Slf4j;
import world.willfrog.review.workflow.ErrorRecord;
import world.willfrog.review.workflow.ItemError;
import world.willfrog.review.workflow.PhaseInfo;
import world.willfrog.review.workflow.ReviewPhase;
import world.willfrog.review.workflow.WorkflowState;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 单个 run 的进度跟踪器，由引擎线程持有。
 * <p>
 * 阶段边界与错误记录会持久化状态；子进度只发布事件，且丢弃比上一次更小的过期更新，
 * 保证 fan-out worker 并发上报时百分比单调。
 */
@Slf4j
public class ProgressTracker {

    private final ProgressStore store;
    private final WorkflowState state;
    private final Object subProgressLock = new Object();
    private volatile ReviewPhase activePhase;
    private SubProgress lastSubProgress;
    private int lastPublishedPercent;

    ProgressTracker(ProgressStore store, WorkflowState state) {
        this.store = store;
        this.state = state;
    }

    public WorkflowState state() {
        return state;
    }

    public void startWorkflow(boolean resumed) {
        if (state.getStartedAt() == null) {
            state.setStartedAt(Instant.now());
        }
        store.saveState(state);
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("resumed", resumed);
        fields.put("completedPhases", phaseValues(state.getCompletedPhases()));
        fields.put("percentComplete", percent(null));
        store.publishEvent(ProgressEventType.RUN_STARTED, state, fields);
        log.info("Review run started: runId={}, subjectId={}, resumed={}", state.getRunId(), state.getSubjectId(), resumed);
    }

    /**
     * 进入新阶段。上一个已返回的阶段在此时记为完成。
     */
    public void startPhase(ReviewPhase phase) {
        completeActivePhase();
        state.setCurrentPhase(phase);
        PhaseInfo info = state.phaseInfoFor(phase);
        info.setStartedAt(Instant.now());
        info.setCompletedAt(null);
        info.setDurationSeconds(null);
        info.setError(null);
        state.setItemsProcessed(0);
        state.setItemsTotal(0);
        synchronized (subProgressLock) {
            lastSubProgress = null;
        }
        activePhase = phase;
        store.saveState(state);
        publishProgress(phase, phase.getDescription(), null);
        log.info("Phase started: runId={}, phase={}", state.getRunId(), phase.getValue());
    }

    public void updateSubProgress(ReviewPhase phase, String detail, int current, int total) {
        synchronized (subProgressLock) {
            if (phase != activePhase) {
                return;
            }
            if (lastSubProgress != null && lastSubProgress.phase() == phase && current < lastSubProgress.current()) {
                return;
            }
            lastSubProgress = new SubProgress(phase, detail, current, total);
            publishProgress(phase, detail, lastSubProgress);
        }
    }

    public void setItemCounts(Integer processed, Integer total) {
        if (processed != null) {
            state.setItemsProcessed(processed);
        }
        if (total != null) {
            state.setItemsTotal(total);
        }
    }

    public void recordError(ReviewPhase phase, String error, String item) {
        state.addError(ErrorRecord.builder()
                .phase(phase == null ? null : phase.getValue())
                .error(error)
                .item(item)
                .timestamp(Instant.now())
                .build());
        store.saveState(state);
    }

    public void recordItemErrors(ReviewPhase phase, List<ItemError> errors) {
        if (errors == null || errors.isEmpty()) {
            return;
        }
        Instant now = Instant.now();
        for (ItemError error : errors) {
            state.addError(ErrorRecord.builder()
                    .phase(phase.getValue())
                    .error(error.error())
                    .item(error.item())
                    .timestamp(now)
                    .build());
        }
        store.saveState(state);
    }

    /**
     * 可恢复失败：记录错误，阶段仍会在下一阶段开始时记为完成。
     */
    public void recordPhaseError(ReviewPhase phase, String error) {
        state.phaseInfoFor(phase).setError(error);
        recordError(phase, error, null);
    }

    /**
     * 致命失败：阶段不记入 completedPhases，重试时重新执行。
     */
    public void failPhase(ReviewPhase phase, String error) {
        PhaseInfo info = state.phaseInfoFor(phase);
        finishInfo(info);
        info.setError(error);
        if (activePhase == phase) {
            activePhase = null;
        }
        recordError(phase, error, null);
        log.warn("Phase failed: runId={}, phase={}, error={}", state.getRunId(), phase.getValue(), error);
    }

    public Map<String, Object> completeWorkflow() {
        completeActivePhase();
        Map<String, Object> metadata = finalMetadata();
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("percentComplete", 100);
        fields.put("metadata", metadata);
        store.publishEvent(ProgressEventType.RUN_COMPLETED, state, fields);
        store.deleteState(state.getRunId());
        log.info("Review run completed: runId={}, errors={}", state.getRunId(), state.getErrorsEncountered().size());
        return metadata;
    }

    public Map<String, Object> failWorkflow(String error) {
        store.saveState(state);
        Map<String, Object> metadata = finalMetadata();
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("phase", state.getCurrentPhase() == null ? null : state.getCurrentPhase().getValue());
        fields.put("error", error);
        fields.put("percentComplete", percent(null));
        fields.put("metadata", metadata);
        store.publishEvent(ProgressEventType.RUN_FAILED, state, fields);
        log.warn("Review run failed: runId={}, error={}", state.getRunId(), error);
        return metadata;
    }

    public Map<String, Object> cancelWorkflow() {
        completeActivePhase();
        state.setCancelled(true);
        store.saveState(state);
        Map<String, Object> metadata = finalMetadata();
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("percentComplete", percent(null));
        fields.put("metadata", metadata);
        store.publishEvent(ProgressEventType.RUN_CANCELLED, state, fields);
        log.info("Review run cancelled: runId={}", state.getRunId());
        return metadata;
    }

    public int percentComplete() {
        synchronized (subProgressLock) {
            return percent(lastSubProgress);
        }
    }

    private void completeActivePhase() {
        ReviewPhase phase = activePhase;
        if (phase == null) {
            return;
        }
        finishInfo(state.phaseInfoFor(phase));
        state.markCompleted(phase);
        activePhase = null;
        log.debug("Phase completed: runId={}, phase={}", state.getRunId(), phase.getValue());
    }

    private void finishInfo(PhaseInfo info) {
        Instant now = Instant.now();
        info.setCompletedAt(now);
        if (info.getStartedAt() != null) {
            info.setDurationSeconds(Duration.between(info.getStartedAt(), now).toMillis() / 1000.0);
        }
    }

    private void publishProgress(ReviewPhase phase, String detail, SubProgress subProgress) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("phase", phase.getValue());
        fields.put("phaseDetail", detail);
        fields.put("percentComplete", percent(subProgress));
        if (subProgress != null) {
            fields.put("current", subProgress.current());
            fields.put("total", subProgress.total());
        }
        store.publishEvent(ProgressEventType.RUN_PROGRESS, state, fields);
    }

    private int percent(SubProgress subProgress) {
        synchronized (subProgressLock) {
            int value = Math.max(lastPublishedPercent, PhaseProgressCalculator.percentComplete(state, subProgress));
            lastPublishedPercent = value;
            return value;
        }
    }

    private Map<String, Object> finalMetadata() {
        List<Map<String, Object>> phases = new ArrayList<>();
        for (ReviewPhase phase : state.getCompletedPhases()) {
            PhaseInfo info = state.getPhaseInfo() == null ? null : state.getPhaseInfo().get(phase.getValue());
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("phase", phase.getValue());
            entry.put("durationSeconds", info == null ? null : info.getDurationSeconds());
            phases.add(entry);
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("phasesCompleted", phases);
        metadata.put("errorsEncountered", state.getErrorsEncountered() == null ? 0 : state.getErrorsEncountered().size());
        metadata.put("totalDurationSeconds", state.getStartedAt() == null
                ? 0.0
                : Duration.between(state.getStartedAt(), Instant.now()).toMillis() / 1000.0);
        return metadata;
    }

    private List<String> phaseValues(List<ReviewPhase> phases) {
        List<String> values = new ArrayList<>();
        if (phases != null) {
            for (ReviewPhase phase : phases) {
                values.add(phase.getValue());
            }
        }
        return values;
    }
}
