package world.willfrog.review.progress;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.test.util.ReflectionTestUtils;
import world.willfrog.review.workflow.ItemError;
import world.willfrog.review.workflow.ReviewPhase;
import world.willfrog.review.workflow.WorkflowState;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class ProgressTrackerTest {

    @Mock
    private StringRedisTemplate redisTemplate;
    @Mock
    private ValueOperations<String, String> valueOperations;

    private ObjectMapper objectMapper;
    private ProgressStore store;
    private WorkflowState state;
    private ProgressTracker tracker;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper().findAndRegisterModules();
        store = new ProgressStore(redisTemplate, objectMapper);
        ReflectionTestUtils.setField(store, "stateTtlSeconds", 86400L);
        ReflectionTestUtils.setField(store, "cancelTtlSeconds", 3600L);
        ReflectionTestUtils.setField(store, "channel", "review.progress");
        lenient().when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        state = WorkflowState.builder().runId("run-1").subjectId("25/01234/F").build();
        tracker = store.tracker(state);
    }

    @Test
    void startPhase_shouldCompletePreviousPhaseRetroactively() {
        tracker.startWorkflow(false);
        tracker.startPhase(ReviewPhase.FETCHING_METADATA);
        assertTrue(state.getCompletedPhases().isEmpty());

        tracker.startPhase(ReviewPhase.FILTERING_DOCUMENTS);

        assertEquals(List.of(ReviewPhase.FETCHING_METADATA), state.getCompletedPhases());
        assertEquals(ReviewPhase.FILTERING_DOCUMENTS, state.getCurrentPhase());
        assertTrue(state.getPhaseInfo().get("fetching_metadata").getDurationSeconds() >= 0);
    }

    @Test
    void failPhase_shouldNotMarkPhaseCompleted() {
        tracker.startPhase(ReviewPhase.FETCHING_METADATA);
        tracker.startPhase(ReviewPhase.FILTERING_DOCUMENTS);

        tracker.failPhase(ReviewPhase.FILTERING_DOCUMENTS, "filter exploded");
        tracker.failWorkflow("filter exploded");

        assertEquals(List.of(ReviewPhase.FETCHING_METADATA), state.getCompletedPhases());
        assertEquals("filter exploded", state.getPhaseInfo().get("filtering_documents").getError());
        assertEquals(1, state.getErrorsEncountered().size());
        verify(redisTemplate, never()).delete("review:workflow_state:run-1");
    }

    @Test
    void percentComplete_shouldStayMonotonicAndReachHundredOnlyOnCompletion() throws Exception {
        tracker.startWorkflow(false);
        for (ReviewPhase phase : ReviewPhase.values()) {
            tracker.startPhase(phase);
            if (phase == ReviewPhase.INGESTING_DOCUMENTS) {
                tracker.updateSubProgress(phase, "Ingesting document 1 of 3", 1, 3);
                tracker.updateSubProgress(phase, "Ingesting document 3 of 3", 3, 3);
                tracker.updateSubProgress(phase, "Ingesting document 2 of 3", 2, 3);
            }
        }
        tracker.completeWorkflow();

        List<JsonNode> events = publishedEvents();
        int previous = -1;
        for (JsonNode event : events) {
            int percent = event.path("percentComplete").asInt();
            assertTrue(percent >= previous, "percent went backwards: " + events);
            if (!"run.completed".equals(event.path("event").asText())) {
                assertTrue(percent < 100);
            }
            previous = percent;
        }
        JsonNode last = events.get(events.size() - 1);
        assertEquals("run.completed", last.path("event").asText());
        assertEquals(100, last.path("percentComplete").asInt());
        assertEquals(7, last.path("metadata").path("phasesCompleted").size());
        assertFalse(events.stream().anyMatch(event -> "Ingesting document 2 of 3".equals(event.path("phaseDetail").asText())));
        verify(redisTemplate).delete("review:workflow_state:run-1");
    }

    @Test
    void recordItemErrors_shouldAppendInOrderAndPersist() {
        tracker.startPhase(ReviewPhase.INGESTING_DOCUMENTS);

        tracker.recordItemErrors(ReviewPhase.INGESTING_DOCUMENTS, List.of(
                new ItemError("a.pdf", "OCR failed"), new ItemError("b.pdf", "timeout")));

        assertEquals(2, state.getErrorsEncountered().size());
        assertEquals("a.pdf", state.getErrorsEncountered().get(0).getItem());
        assertEquals("ingesting_documents", state.getErrorsEncountered().get(1).getPhase());
        verify(valueOperations, atLeastOnce()).set(eq("review:workflow_state:run-1"), anyString(), any(Duration.class));
    }

    @Test
    void cancelWorkflow_shouldKeepStateAndPublishCancelledEvent() throws Exception {
        tracker.startPhase(ReviewPhase.FETCHING_METADATA);

        Map<String, Object> metadata = tracker.cancelWorkflow();

        assertTrue(state.isCancelled());
        assertEquals(List.of(ReviewPhase.FETCHING_METADATA), state.getCompletedPhases());
        assertEquals(1, ((List<?>) metadata.get("phasesCompleted")).size());
        List<JsonNode> events = publishedEvents();
        assertEquals("run.cancelled", events.get(events.size() - 1).path("event").asText());
        verify(redisTemplate, never()).delete("review:workflow_state:run-1");
    }

    private List<JsonNode> publishedEvents() throws Exception {
        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(redisTemplate, atLeastOnce()).convertAndSend(eq("review.progress"), captor.capture());
        List<JsonNode> events = new ArrayList<>();
        for (Object value : captor.getAllValues()) {
            events.add(objectMapper.readTree((String) value));
        }
        return events;
    }
}
