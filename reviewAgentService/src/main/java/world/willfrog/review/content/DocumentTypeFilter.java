package world.willfrog.review.content;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 按文档类型做规则过滤。
 * <p>
 * 顺序：无类型放行 -> 命中白名单放行 -> 命中公众意见黑名单过滤 -> 其余放行。匹配大小写不敏感、子串匹配。
 */
@Component
@Slf4j
public class DocumentTypeFilter implements DocumentFilter {

    static final List<String> CORE_PATTERNS = List.of(
            "planning statement", "design and access", "design & access", "application form",
            "proposed plan", "proposed drawing", "site plan", "location plan", "block plan",
            "elevation", "floor plan", "section");

    static final List<String> ASSESSMENT_PATTERNS = List.of(
            "transport assessment", "transport statement", "travel plan", "highway", "parking",
            "environmental impact", "environmental statement", "heritage statement", "heritage impact",
            "archaeological", "flood risk assessment", "drainage", "ecology", "ecological", "biodiversity",
            "arboricultural", "tree survey", "noise assessment", "air quality", "energy statement",
            "sustainability");

    static final List<String> OFFICER_PATTERNS = List.of(
            "officer report", "officer's report", "planning officer", "case officer", "committee report",
            "delegated report", "decision notice", "decision letter", "planning condition",
            "conditions document", "approval notice", "refusal notice", "s106", "section 106",
            "legal agreement");

    static final List<String> PUBLIC_COMMENT_PATTERNS = List.of(
            "public comment", "comment from", "objection", "representation from", "letter from resident",
            "letter from neighbour", "letter of objection", "letter of support", "petition",
            "consultation response");

    @Override
    public DocumentFilterResult filter(String applicationRef, List<Map<String, Object>> documents) {
        List<Map<String, Object>> selected = new ArrayList<>();
        List<Map<String, Object>> filteredOut = new ArrayList<>();
        if (documents == null) {
            return new DocumentFilterResult(selected, filteredOut);
        }
        for (Map<String, Object> document : documents) {
            Object type = document.get("document_type");
            String reason = denyReason(type == null ? null : String.valueOf(type));
            if (reason == null) {
                selected.add(document);
                continue;
            }
            Map<String, Object> skipped = new LinkedHashMap<>(document);
            skipped.put("filter_reason", reason);
            filteredOut.add(skipped);
        }
        log.info("Document filter applied: applicationRef={}, selected={}, filteredOut={}",
                applicationRef, selected.size(), filteredOut.size());
        return new DocumentFilterResult(selected, filteredOut);
    }

    /**
     * @return 过滤原因，放行时为 null
     */
    String denyReason(String documentType) {
        if (documentType == null || documentType.isBlank()) {
            return null;
        }
        String normalized = documentType.toLowerCase(Locale.ROOT);
        if (matches(normalized, CORE_PATTERNS)
                || matches(normalized, ASSESSMENT_PATTERNS)
                || matches(normalized, OFFICER_PATTERNS)) {
            return null;
        }
        if (matches(normalized, PUBLIC_COMMENT_PATTERNS)) {
            return "Public comment - not relevant for policy review";
        }
        return null;
    }

    private boolean matches(String value, List<String> patterns) {
        for (String pattern : patterns) {
            if (value.contains(pattern)) {
                return true;
            }
        }
        return false;
    }
}
