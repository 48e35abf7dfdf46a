package world.willfrog.review.content;

import org.springframework.stereotype.Component;
import world.willfrog.review.workflow.ReviewRunContext;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 默认的审查生成器：把各主题的检索证据整理为结构化摘要（引用的文档片段与政策条款）。
 */
@Component
public class EvidenceDigestReviewGenerator implements ReviewGenerator {

    @Override
    public Map<String, Object> generate(ReviewRunContext context) {
        if (context.getEvidence() == null || context.getEvidence().isEmpty()) {
            throw new IllegalStateException("No analysis evidence available for " + context.getApplicationRef());
        }
        List<Map<String, Object>> topics = new ArrayList<>();
        int supported = 0;
        for (Map.Entry<String, Object> entry : context.getEvidence().entrySet()) {
            Map<?, ?> evidence = entry.getValue() instanceof Map<?, ?> map ? map : Map.of();
            List<String> citations = collect(evidence.get("application_results"), "chunk_id");
            List<String> policyRefs = policyReferences(evidence.get("policy_results"));
            Map<String, Object> topic = new LinkedHashMap<>();
            topic.put("topic", entry.getKey());
            topic.put("citations", citations);
            topic.put("policy_references", policyRefs);
            topic.put("evidence_found", !citations.isEmpty());
            if (!citations.isEmpty()) {
                supported++;
            }
            topics.add(topic);
        }
        Map<String, Object> review = new LinkedHashMap<>();
        review.put("application_ref", context.getApplicationRef());
        review.put("documents_reviewed", context.getIngestedDocuments() == null ? 0 : context.getIngestedDocuments().size());
        review.put("summary", supported + " of " + topics.size() + " topics supported by application evidence");
        review.put("topics", topics);
        review.put("generated_at", Instant.now().toString());
        return review;
    }

    private List<String> collect(Object results, String field) {
        Set<String> values = new LinkedHashSet<>();
        if (results instanceof List<?> list) {
            for (Object item : list) {
                if (item instanceof Map<?, ?> map && map.get(field) != null) {
                    values.add(String.valueOf(map.get(field)));
                }
            }
        }
        return new ArrayList<>(values);
    }

    private List<String> policyReferences(Object results) {
        Set<String> values = new LinkedHashSet<>();
        if (results instanceof List<?> list) {
            for (Object item : list) {
                if (!(item instanceof Map<?, ?> map)) {
                    continue;
                }
                Object source = map.get("source");
                Object section = map.get("section_ref");
                if (source == null) {
                    continue;
                }
                values.add(section == null ? String.valueOf(source) : source + " " + section);
            }
        }
        return new ArrayList<>(values);
    }
}
