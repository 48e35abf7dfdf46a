package world.willfrog.review.workflow;

public record ItemError(String item, String error) {
}
