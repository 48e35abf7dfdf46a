package world.willfrog.review.workflow;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorRecord {
    private String phase;
    private String error;
    /** 出错的单个条目（文档、主题），阶段级错误为空。 */
    private String item;
    private Instant timestamp;
}
