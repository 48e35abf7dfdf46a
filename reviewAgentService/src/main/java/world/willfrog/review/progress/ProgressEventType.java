package world.willfrog.review.progress;

public enum ProgressEventType {
    RUN_STARTED("run.started"),
    RUN_PROGRESS("run.progress"),
    RUN_COMPLETED("run.completed"),
    RUN_FAILED("run.failed"),
    RUN_CANCELLED("run.cancelled");

    private final String value;

    ProgressEventType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
