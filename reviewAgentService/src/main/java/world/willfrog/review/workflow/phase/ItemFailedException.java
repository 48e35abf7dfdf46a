package world.willfrog.review.workflow.phase;

/**
 * 工具调用成功但返回了 error 状态的单个条目。
 */
public class ItemFailedException extends RuntimeException {

    public ItemFailedException(String message) {
        super(message);
    }
}
