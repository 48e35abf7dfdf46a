package world.willfrog.review.progress;

import world.willfrog.review.workflow.ReviewPhase;
import world.willfrog.review.workflow.WorkflowState;

/**
 * 加权进度：已完成阶段权重之和 + 当前阶段权重按子进度折算（向下取整），运行中封顶 99。
 */
public final class PhaseProgressCalculator {

    public static final int MAX_RUNNING_PERCENT = 99;

    private PhaseProgressCalculator() {
    }

    public static int percentComplete(WorkflowState state, SubProgress subProgress) {
        if (state == null) {
            return 0;
        }
        int percent = 0;
        if (state.getCompletedPhases() != null) {
            for (ReviewPhase phase : state.getCompletedPhases()) {
                percent += phase.getWeight();
            }
        }
        ReviewPhase current = state.getCurrentPhase();
        if (current != null
                && !state.isCompleted(current)
                && subProgress != null
                && subProgress.phase() == current
                && subProgress.total() > 0) {
            int done = Math.max(0, Math.min(subProgress.current(), subProgress.total()));
            percent += current.getWeight() * done / subProgress.total();
        }
        return Math.min(percent, MAX_RUNNING_PERCENT);
    }
}
