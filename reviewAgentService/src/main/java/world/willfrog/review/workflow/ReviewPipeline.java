package world.willfrog.review.workflow;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import world.willfrog.review.workflow.phase.AnalyseApplicationPhase;
import world.willfrog.review.workflow.phase.DownloadDocumentsPhase;
import world.willfrog.review.workflow.phase.FetchMetadataPhase;
import world.willfrog.review.workflow.phase.FilterDocumentsPhase;
import world.willfrog.review.workflow.phase.GenerateReviewPhase;
import world.willfrog.review.workflow.phase.IngestDocumentsPhase;
import world.willfrog.review.workflow.phase.VerifyReviewPhase;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * 编译期固定的阶段序列，按 {@link ReviewPhase} 声明顺序排列。
 */
@Component
public class ReviewPipeline {

    private static final int TOTAL_WEIGHT = 100;

    private final List<PhaseDescriptor> phases;

    @Autowired
    public ReviewPipeline(FetchMetadataPhase fetchMetadata,
                          FilterDocumentsPhase filterDocuments,
                          DownloadDocumentsPhase downloadDocuments,
                          IngestDocumentsPhase ingestDocuments,
                          AnalyseApplicationPhase analyseApplication,
                          GenerateReviewPhase generateReview,
                          VerifyReviewPhase verifyReview) {
        this(phase -> switch (phase) {
            case FETCHING_METADATA -> fetchMetadata;
            case FILTERING_DOCUMENTS -> filterDocuments;
            case DOWNLOADING_DOCUMENTS -> downloadDocuments;
            case INGESTING_DOCUMENTS -> ingestDocuments;
            case ANALYSING_APPLICATION -> analyseApplication;
            case GENERATING_REVIEW -> generateReview;
            case VERIFYING_REVIEW -> verifyReview;
        });
    }

    public ReviewPipeline(Function<ReviewPhase, PhaseHandler> handlers) {
        List<PhaseDescriptor> descriptors = new ArrayList<>();
        int totalWeight = 0;
        for (ReviewPhase phase : ReviewPhase.values()) {
            PhaseHandler handler = handlers.apply(phase);
            if (handler == null || handler.phase() != phase) {
                throw new IllegalStateException("Missing handler for phase " + phase.getValue());
            }
            descriptors.add(new PhaseDescriptor(phase, phase.getWeight(), handler));
            totalWeight += phase.getWeight();
        }
        if (totalWeight != TOTAL_WEIGHT) {
            throw new IllegalStateException("Phase weights must sum to " + TOTAL_WEIGHT + " but were " + totalWeight);
        }
        this.phases = List.copyOf(descriptors);
    }

    public List<PhaseDescriptor> phases() {
        return phases;
    }
}
