package world.willfrog.review.progress;

import world.willfrog.review.workflow.ReviewPhase;

/**
 * 阶段内进度，例如 "Ingesting document 3 of 10"。不持久化。
 */
public record SubProgress(ReviewPhase phase, String detail, int current, int total) {
}
