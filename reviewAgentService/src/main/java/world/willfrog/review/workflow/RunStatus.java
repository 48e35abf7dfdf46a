package world.willfrog.review.workflow;

public enum RunStatus {
    COMPLETED,
    FAILED,
    CANCELLED
}
