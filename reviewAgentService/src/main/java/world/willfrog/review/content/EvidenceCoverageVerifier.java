package world.willfrog.review.content;

import org.springframework.stereotype.Component;
import world.willfrog.review.workflow.ReviewRunContext;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 默认的审查校验：每条引用必须出现在检索证据中，每个主题至少有一条申请文档证据。
 */
@Component
public class EvidenceCoverageVerifier implements ReviewVerifier {

    @Override
    public Verification verify(ReviewRunContext context) {
        Map<String, Object> review = context.getReview();
        if (review == null || review.isEmpty()) {
            throw new IllegalStateException("No review to verify for " + context.getApplicationRef());
        }
        List<String> issues = new ArrayList<>();
        Object topics = review.get("topics");
        if (topics instanceof List<?> list) {
            for (Object item : list) {
                if (!(item instanceof Map<?, ?> topic)) {
                    continue;
                }
                String name = String.valueOf(topic.get("topic"));
                Set<String> known = chunkIds(context.getEvidence().get(name));
                Object citations = topic.get("citations");
                if (!(citations instanceof List<?> cited) || cited.isEmpty()) {
                    issues.add("No application evidence for topic: " + name);
                    continue;
                }
                for (Object citation : cited) {
                    if (!known.contains(String.valueOf(citation))) {
                        issues.add("Citation " + citation + " not found in evidence for topic: " + name);
                    }
                }
            }
        }
        return new Verification(issues.isEmpty(), issues);
    }

    private Set<String> chunkIds(Object evidence) {
        Set<String> ids = new HashSet<>();
        if (evidence instanceof Map<?, ?> map && map.get("application_results") instanceof List<?> results) {
            for (Object result : results) {
                if (result instanceof Map<?, ?> chunk && chunk.get("chunk_id") != null) {
                    ids.add(String.valueOf(chunk.get("chunk_id")));
                }
            }
        }
        return ids;
    }
}
