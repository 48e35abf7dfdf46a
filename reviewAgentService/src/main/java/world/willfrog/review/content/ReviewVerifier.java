package world.willfrog.review.content;

import world.willfrog.review.workflow.ReviewRunContext;

import java.util.List;

public interface ReviewVerifier {

    Verification verify(ReviewRunContext context);

    record Verification(boolean verified, List<String> issues) {
    }
}
