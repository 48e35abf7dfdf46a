package world.willfrog.review.workflow;

import java.util.List;
import java.util.function.Function;

/**
 * 测试用阶段处理器：记录执行顺序，返回预设结果。
 */
class StubPhaseHandler implements PhaseHandler {

    private final ReviewPhase phase;
    private final List<ReviewPhase> executed;
    private final Function<PhaseExecution, PhaseOutcome> behaviour;

    StubPhaseHandler(ReviewPhase phase, List<ReviewPhase> executed, Function<PhaseExecution, PhaseOutcome> behaviour) {
        this.phase = phase;
        this.executed = executed;
        this.behaviour = behaviour;
    }

    static StubPhaseHandler succeeding(ReviewPhase phase) {
        return new StubPhaseHandler(phase, null, execution -> PhaseOutcome.success());
    }

    @Override
    public ReviewPhase phase() {
        return phase;
    }

    @Override
    public PhaseOutcome execute(PhaseExecution execution) {
        if (executed != null) {
            executed.add(phase);
        }
        return behaviour.apply(execution);
    }
}
