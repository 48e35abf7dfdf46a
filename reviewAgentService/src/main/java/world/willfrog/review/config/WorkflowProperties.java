package world.willfrog.review.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * 审查流程配置。
 */
@Data
@ConfigurationProperties(prefix = "review.workflow")
public class WorkflowProperties {

    /**
     * 跳过文档过滤阶段（保留全部文档）。
     */
    private boolean skipFilter = false;

    private FanOut fanOut = new FanOut();

    private Timeouts timeouts = new Timeouts();

    private Analysis analysis = new Analysis();

    @Data
    public static class FanOut {
        /**
         * 单次 fan-out 同时在途的最大调用数。
         */
        private int concurrency = 4;

        /**
         * 共享线程池大小。
         */
        private int poolSize = 8;
    }

    @Data
    public static class Timeouts {
        private long fetchMetadataMs = 30000;
        private long downloadMs = 300000;
        private long ingestMs = 120000;
        private long searchMs = 30000;
    }

    @Data
    public static class Analysis {
        /**
         * 每个主题同时检索申请文档与政策库。
         */
        private List<String> topics = new ArrayList<>(List.of(
                "cycle parking provision",
                "pedestrian and cycle access",
                "car parking standards",
                "trip generation and highway impact",
                "public transport accessibility"
        ));

        private int maxResults = 5;
    }
}
