package world.willfrog.review.workflow;

/**
 * @param runId          run 标识（同一个 runId 重复提交即恢复执行）
 * @param applicationRef 规划申请编号
 */
public record ReviewRunRequest(String runId, String applicationRef) {
}
