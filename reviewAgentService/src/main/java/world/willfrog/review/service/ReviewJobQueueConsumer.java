package world.willfrog.review.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 从 Redis 列表拉取审查任务并提交执行。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReviewJobQueueConsumer {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final ReviewJobService reviewJobService;

    @Value("${review.jobs.enabled:true}")
    private boolean enabled;

    @Value("${review.jobs.queue-key:review:jobs}")
    private String queueKey;

    @Value("${review.jobs.batch-size:10}")
    private int batchSize;

    @Scheduled(fixedDelayString = "${review.jobs.poll-interval-ms:2000}")
    public void poll() {
        if (!enabled) {
            return;
        }
        for (int i = 0; i < Math.max(1, batchSize); i++) {
            String raw;
            try {
                raw = redisTemplate.opsForList().leftPop(queueKey);
            } catch (RuntimeException e) {
                log.warn("Poll review job queue failed: queue={}, error={}", queueKey, e.getMessage());
                return;
            }
            if (raw == null) {
                return;
            }
            dispatch(raw);
        }
    }

    void dispatch(String raw) {
        ReviewJobMessage message;
        try {
            message = objectMapper.readValue(raw, ReviewJobMessage.class);
        } catch (JsonProcessingException e) {
            log.warn("Drop malformed review job: error={}, payload={}", e.getOriginalMessage(), preview(raw));
            return;
        }
        if (message.applicationRef() == null || message.applicationRef().isBlank()) {
            log.warn("Drop review job without application_ref: payload={}", preview(raw));
            return;
        }
        reviewJobService.submit(message.reviewId(), message.applicationRef());
    }

    private String preview(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= 200 ? text : text.substring(0, 200) + "...";
    }
}
