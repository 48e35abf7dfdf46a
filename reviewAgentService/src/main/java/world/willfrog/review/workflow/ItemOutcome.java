package world.willfrog.review.workflow;

public enum ItemOutcome {
    SUCCEEDED,
    SKIPPED
}
