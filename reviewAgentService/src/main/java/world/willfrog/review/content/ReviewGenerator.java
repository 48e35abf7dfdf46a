package world.willfrog.review.content;

import world.willfrog.review.workflow.ReviewRunContext;

import java.util.Map;

public interface ReviewGenerator {

    Map<String, Object> generate(ReviewRunContext context);
}
