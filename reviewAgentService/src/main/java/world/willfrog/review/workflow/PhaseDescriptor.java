package world.willfrog.review.workflow;

public record PhaseDescriptor(ReviewPhase phase, int weight, PhaseHandler handler) {
}
