package world.willfrog.review.workflow;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 一次审查 run 的持久化状态。
 * <p>
 * 只由引擎线程修改。阶段在处理器返回后（成功或可恢复失败）才进入 completedPhases，
 * 致命失败的阶段不会记入，重试时会重新执行。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowState {
    private String runId;
    private String subjectId;
    private ReviewPhase currentPhase;
    @Builder.Default
    private List<ReviewPhase> completedPhases = new ArrayList<>();
    /** phase value -> 阶段耗时与错误。 */
    @Builder.Default
    private Map<String, PhaseInfo> phaseInfo = new LinkedHashMap<>();
    private int itemsProcessed;
    private int itemsTotal;
    @Builder.Default
    private List<ErrorRecord> errorsEncountered = new ArrayList<>();
    private Instant startedAt;
    private boolean cancelled;
    @Builder.Default
    private ReviewRunContext context = new ReviewRunContext();

    public boolean isCompleted(ReviewPhase phase) {
        return completedPhases != null && completedPhases.contains(phase);
    }

    public void markCompleted(ReviewPhase phase) {
        if (completedPhases == null) {
            completedPhases = new ArrayList<>();
        }
        if (!completedPhases.contains(phase)) {
            completedPhases.add(phase);
        }
    }

    public PhaseInfo phaseInfoFor(ReviewPhase phase) {
        if (phaseInfo == null) {
            phaseInfo = new LinkedHashMap<>();
        }
        return phaseInfo.computeIfAbsent(phase.getValue(), key -> new PhaseInfo());
    }

    public void addError(ErrorRecord error) {
        if (errorsEncountered == null) {
            errorsEncountered = new ArrayList<>();
        }
        errorsEncountered.add(error);
    }
}
