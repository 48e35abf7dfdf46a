package world.willfrog.review.workflow;

import lombok.Builder;
import lombok.Getter;

import java.util.List;

/**
 * 阶段处理器的返回值。失败时 recoverable 决定引擎继续（降级）还是终止。
 */
@Getter
@Builder
public class PhaseOutcome {
    private final boolean success;
    private final boolean recoverable;
    private final String error;
    @Builder.Default
    private final List<ItemError> itemErrors = List.of();
    /** 为 null 表示该阶段不统计条目。 */
    private final Integer itemsProcessed;
    private final Integer itemsTotal;

    public static PhaseOutcome success() {
        return PhaseOutcome.builder().success(true).build();
    }

    public static PhaseOutcome success(int processed, int total, List<ItemError> itemErrors) {
        return PhaseOutcome.builder()
                .success(true)
                .itemsProcessed(processed)
                .itemsTotal(total)
                .itemErrors(itemErrors == null ? List.of() : List.copyOf(itemErrors))
                .build();
    }

    public static PhaseOutcome fatal(String error) {
        return PhaseOutcome.builder().success(false).recoverable(false).error(error).build();
    }

    public static PhaseOutcome fatal(String error, int processed, int total, List<ItemError> itemErrors) {
        return PhaseOutcome.builder()
                .success(false)
                .recoverable(false)
                .error(error)
                .itemsProcessed(processed)
                .itemsTotal(total)
                .itemErrors(itemErrors == null ? List.of() : List.copyOf(itemErrors))
                .build();
    }

    public static PhaseOutcome recoverable(String error) {
        return PhaseOutcome.builder().success(false).recoverable(true).error(error).build();
    }

    public static PhaseOutcome recoverable(String error, List<ItemError> itemErrors) {
        return PhaseOutcome.builder()
                .success(false)
                .recoverable(true)
                .error(error)
                .itemErrors(itemErrors == null ? List.of() : List.copyOf(itemErrors))
                .build();
    }
}
