package world.willfrog.review.workflow;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 审查流程的固定阶段，声明顺序即执行顺序，权重之和为 100。
 */
public enum ReviewPhase {
    FETCHING_METADATA("fetching_metadata", 5, "Fetching application metadata"),
    FILTERING_DOCUMENTS("filtering_documents", 5, "Filtering documents"),
    DOWNLOADING_DOCUMENTS("downloading_documents", 15, "Downloading documents"),
    INGESTING_DOCUMENTS("ingesting_documents", 25, "Ingesting documents"),
    ANALYSING_APPLICATION("analysing_application", 25, "Analysing application"),
    GENERATING_REVIEW("generating_review", 15, "Generating review"),
    VERIFYING_REVIEW("verifying_review", 10, "Verifying review");

    private final String value;
    private final int weight;
    private final String description;

    ReviewPhase(String value, int weight, String description) {
        this.value = value;
        this.weight = weight;
        this.description = description;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public int getWeight() {
        return weight;
    }

    public String getDescription() {
        return description;
    }

    @JsonCreator
    public static ReviewPhase fromValue(String value) {
        for (ReviewPhase phase : values()) {
            if (phase.value.equals(value)) {
                return phase;
            }
        }
        throw new IllegalArgumentException("Unknown review phase: " + value);
    }
}
