package world.willfrog.review.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 队列中的审查任务消息。
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReviewJobMessage(@JsonProperty("review_id") String reviewId,
                               @JsonProperty("application_ref") String applicationRef) {
}
