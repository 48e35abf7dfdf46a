package world.willfrog.review.workflow;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowResult {
    public static final String CANCELLED_ERROR = "run cancelled";

    private String runId;
    private String subjectId;
    private RunStatus status;
    private String error;
    /** 致命失败所在阶段。 */
    private ReviewPhase failedPhase;
    @Builder.Default
    private List<ReviewPhase> completedPhases = new ArrayList<>();
    @Builder.Default
    private List<ErrorRecord> errors = new ArrayList<>();
    private ReviewRunContext context;
    private double durationSeconds;

    public boolean isSuccess() {
        return status == RunStatus.COMPLETED;
    }
}
