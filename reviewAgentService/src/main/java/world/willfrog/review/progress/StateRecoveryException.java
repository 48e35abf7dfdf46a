package world.willfrog.review.progress;

/**
 * 持久化状态无法读取或解析。调用方应放弃恢复，从头执行。
 */
public class StateRecoveryException extends RuntimeException {

    private final String runId;

    public StateRecoveryException(String runId, String message, Throwable cause) {
        super(message, cause);
        this.runId = runId;
    }

    public String getRunId() {
        return runId;
    }
}
