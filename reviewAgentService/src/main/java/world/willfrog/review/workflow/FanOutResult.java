package world.willfrog.review.workflow;

import java.util.List;

public record FanOutResult(int total, int succeeded, int failed, int skipped, List<ItemError> errors) {

    public static FanOutResult empty() {
        return new FanOutResult(0, 0, 0, 0, List.of());
    }

    /**
     * 已完成（成功或跳过）的条目数。
     */
    public int processed() {
        return succeeded + skipped;
    }

    /**
     * 有条目但没有任何条目成功（全部失败或全部跳过）。
     */
    public boolean noneSucceeded() {
        return succeeded == 0 && total > 0;
    }
}
