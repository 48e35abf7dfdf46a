package world.willfrog.review.workflow;

/**
 * 单个阶段的处理逻辑。处理器把异常转换为 {@link PhaseOutcome}，只有编程错误会向上抛出。
 */
public interface PhaseHandler {

    ReviewPhase phase();

    PhaseOutcome execute(PhaseExecution execution);
}
