package world.willfrog.review.progress;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;
import world.willfrog.review.workflow.WorkflowState;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 审查 run 的进度与状态存储。
 * <p>
 * 职责：
 * 1. 以 JSON 形式把 {@link WorkflowState} 写入 Redis（带 TTL），用于进程重启后的恢复；
 * 2. 在 Redis 频道上发布进度事件；
 * 3. 通过 cancel key 是否存在判断 run 是否被取消。
 * <p>
 * 写入与发布失败只记录日志，不影响 run 本身。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProgressStore {

    public static final String STATE_KEY_PREFIX = "review:workflow_state:";
    public static final String CANCEL_KEY_PREFIX = "review:cancel:";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    @Value("${review.progress.state-ttl-seconds:86400}")
    private long stateTtlSeconds;

    @Value("${review.progress.cancel-ttl-seconds:3600}")
    private long cancelTtlSeconds;

    @Value("${review.progress.channel:review.progress}")
    private String channel;

    /**
     * 读取持久化状态。
     *
     * @throws StateRecoveryException 状态存在但无法解析，或 Redis 读取失败
     */
    public Optional<WorkflowState> loadState(String runId) {
        if (runId == null || runId.isBlank()) {
            return Optional.empty();
        }
        String json;
        try {
            json = redisTemplate.opsForValue().get(stateKey(runId));
        } catch (RuntimeException e) {
            throw new StateRecoveryException(runId, "Failed to read workflow state: " + e.getMessage(), e);
        }
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, WorkflowState.class));
        } catch (JsonProcessingException e) {
            throw new StateRecoveryException(runId, "Unreadable workflow state: " + e.getOriginalMessage(), e);
        }
    }

    public void saveState(WorkflowState state) {
        if (state == null || state.getRunId() == null || state.getRunId().isBlank()) {
            return;
        }
        try {
            String json = objectMapper.writeValueAsString(state);
            redisTemplate.opsForValue().set(stateKey(state.getRunId()), json, Duration.ofSeconds(stateTtlSeconds));
        } catch (JsonProcessingException e) {
            log.warn("Serialize workflow state failed: runId={}, error={}", state.getRunId(), e.getOriginalMessage());
        } catch (RuntimeException e) {
            log.warn("Save workflow state failed: runId={}, error={}", state.getRunId(), e.getMessage());
        }
    }

    public void deleteState(String runId) {
        if (runId == null || runId.isBlank()) {
            return;
        }
        try {
            redisTemplate.delete(stateKey(runId));
        } catch (RuntimeException e) {
            log.warn("Delete workflow state failed: runId={}, error={}", runId, e.getMessage());
        }
    }

    /**
     * 发布进度事件：{event, runId, subjectId, timestamp, ...fields}。
     */
    public void publishEvent(ProgressEventType type, WorkflowState state, Map<String, Object> fields) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("event", type.getValue());
        event.put("runId", state == null ? null : state.getRunId());
        event.put("subjectId", state == null ? null : state.getSubjectId());
        event.put("timestamp", Instant.now().toString());
        if (fields != null) {
            event.putAll(fields);
        }
        try {
            redisTemplate.convertAndSend(channel, objectMapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            log.warn("Serialize progress event failed: event={}, error={}", type.getValue(), e.getOriginalMessage());
        } catch (RuntimeException e) {
            log.warn("Publish progress event failed: event={}, runId={}, error={}",
                    type.getValue(), event.get("runId"), e.getMessage());
        }
    }

    public int percentComplete(WorkflowState state, SubProgress subProgress) {
        return PhaseProgressCalculator.percentComplete(state, subProgress);
    }

    /**
     * 检查取消信号。首次检测到后锁存到 state.cancelled 并持久化；Redis 不可用时返回已锁存的值。
     */
    public boolean checkCancellation(WorkflowState state) {
        if (state.isCancelled()) {
            return true;
        }
        try {
            if (Boolean.TRUE.equals(redisTemplate.hasKey(cancelKey(state.getRunId())))) {
                state.setCancelled(true);
                saveState(state);
                log.info("Cancellation requested: runId={}", state.getRunId());
                return true;
            }
        } catch (RuntimeException e) {
            log.warn("Check cancellation failed: runId={}, error={}", state.getRunId(), e.getMessage());
        }
        return state.isCancelled();
    }

    public boolean requestCancellation(String runId) {
        if (runId == null || runId.isBlank()) {
            return false;
        }
        try {
            redisTemplate.opsForValue().set(cancelKey(runId), Instant.now().toString(), Duration.ofSeconds(cancelTtlSeconds));
            return true;
        } catch (RuntimeException e) {
            log.warn("Request cancellation failed: runId={}, error={}", runId, e.getMessage());
            return false;
        }
    }

    public ProgressTracker tracker(WorkflowState state) {
        return new ProgressTracker(this, state);
    }

    private String stateKey(String runId) {
        return STATE_KEY_PREFIX + runId;
    }

    private String cancelKey(String runId) {
        return CANCEL_KEY_PREFIX + runId;
    }
}
