package world.willfrog.review.workflow;

/**
 * fan-out 中对单个条目的处理。抛出任何异常即视为该条目失败。
 */
@FunctionalInterface
public interface ItemTask<T> {

    ItemOutcome run(T item) throws Exception;
}
