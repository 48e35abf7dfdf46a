package world.willfrog.review.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.test.util.ReflectionTestUtils;
import world.willfrog.review.config.WorkflowProperties;
import world.willfrog.review.progress.ProgressStore;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WorkflowEngineTest {

    private static final String RUN_ID = "run-1";
    private static final String STATE_KEY = "review:workflow_state:" + RUN_ID;
    private static final String CANCEL_KEY = "review:cancel:" + RUN_ID;

    @Mock
    private StringRedisTemplate redisTemplate;
    @Mock
    private ValueOperations<String, String> valueOperations;

    private ObjectMapper objectMapper;
    private ExecutorService pool;
    private List<ReviewPhase> executed;
    private Map<ReviewPhase, Function<PhaseExecution, PhaseOutcome>> behaviours;
    private WorkflowEngine engine;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper().findAndRegisterModules();
        lenient().when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        ProgressStore progressStore = new ProgressStore(redisTemplate, objectMapper);
        ReflectionTestUtils.setField(progressStore, "stateTtlSeconds", 86400L);
        ReflectionTestUtils.setField(progressStore, "cancelTtlSeconds", 3600L);
        ReflectionTestUtils.setField(progressStore, "channel", "review.progress");

        pool = Executors.newFixedThreadPool(4);
        executed = Collections.synchronizedList(new ArrayList<>());
        behaviours = new EnumMap<>(ReviewPhase.class);
        ReviewPipeline pipeline = new ReviewPipeline(phase -> new StubPhaseHandler(phase, executed,
                execution -> behaviours.getOrDefault(phase, ignored -> PhaseOutcome.success()).apply(execution)));
        engine = new WorkflowEngine(pipeline, progressStore, new FanOutExecutor(pool), new WorkflowProperties());
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void run_shouldExecuteEveryPhaseAndDeleteStateOnSuccess() {
        WorkflowResult result = engine.run(new ReviewRunRequest(RUN_ID, "25/01234/F"));

        assertEquals(RunStatus.COMPLETED, result.getStatus());
        assertEquals(Arrays.asList(ReviewPhase.values()), executed);
        assertEquals(Arrays.asList(ReviewPhase.values()), result.getCompletedPhases());
        verify(redisTemplate).delete(STATE_KEY);
    }

    @Test
    void run_shouldSkipCompletedPrefixWhenResuming() throws Exception {
        WorkflowState persisted = persistedState(ReviewPhase.DOWNLOADING_DOCUMENTS,
                ReviewPhase.FETCHING_METADATA, ReviewPhase.FILTERING_DOCUMENTS);
        persisted.getContext().setDownloadedPaths(new ArrayList<>(List.of("/data/a.pdf")));
        when(valueOperations.get(STATE_KEY)).thenReturn(objectMapper.writeValueAsString(persisted));
        List<List<String>> seenPaths = new ArrayList<>();
        behaviours.put(ReviewPhase.INGESTING_DOCUMENTS, execution -> {
            seenPaths.add(execution.context().getDownloadedPaths());
            return PhaseOutcome.success();
        });

        WorkflowResult result = engine.run(new ReviewRunRequest(RUN_ID, "25/01234/F"));

        assertEquals(RunStatus.COMPLETED, result.getStatus());
        assertEquals(List.of(ReviewPhase.DOWNLOADING_DOCUMENTS, ReviewPhase.INGESTING_DOCUMENTS,
                ReviewPhase.ANALYSING_APPLICATION, ReviewPhase.GENERATING_REVIEW, ReviewPhase.VERIFYING_REVIEW), executed);
        assertEquals(List.of(List.of("/data/a.pdf")), seenPaths);
    }

    @Test
    void run_shouldRerunEveryPhaseAfterResumePoint() throws Exception {
        WorkflowState persisted = persistedState(ReviewPhase.DOWNLOADING_DOCUMENTS,
                ReviewPhase.FETCHING_METADATA, ReviewPhase.FILTERING_DOCUMENTS, ReviewPhase.INGESTING_DOCUMENTS);
        when(valueOperations.get(STATE_KEY)).thenReturn(objectMapper.writeValueAsString(persisted));

        engine.run(new ReviewRunRequest(RUN_ID, "25/01234/F"));

        assertEquals(List.of(ReviewPhase.DOWNLOADING_DOCUMENTS, ReviewPhase.INGESTING_DOCUMENTS,
                ReviewPhase.ANALYSING_APPLICATION, ReviewPhase.GENERATING_REVIEW, ReviewPhase.VERIFYING_REVIEW), executed);
    }

    @Test
    void run_shouldStartFreshWhenPersistedStateIsUnreadable() {
        when(valueOperations.get(STATE_KEY)).thenReturn("{\"currentPhase\":\"renamed_phase\"}");

        WorkflowResult result = engine.run(new ReviewRunRequest(RUN_ID, "25/01234/F"));

        assertEquals(RunStatus.COMPLETED, result.getStatus());
        assertEquals(Arrays.asList(ReviewPhase.values()), executed);
    }

    @Test
    void run_shouldStopBetweenPhasesWhenCancelled() throws Exception {
        when(redisTemplate.hasKey(CANCEL_KEY)).thenReturn(false, false, true);

        WorkflowResult result = engine.run(new ReviewRunRequest(RUN_ID, "25/01234/F"));

        assertEquals(RunStatus.CANCELLED, result.getStatus());
        assertEquals("run cancelled", result.getError());
        assertEquals(List.of(ReviewPhase.FETCHING_METADATA, ReviewPhase.FILTERING_DOCUMENTS), executed);
        assertEquals(List.of(ReviewPhase.FETCHING_METADATA, ReviewPhase.FILTERING_DOCUMENTS), result.getCompletedPhases());
        verify(redisTemplate, never()).delete(STATE_KEY);
        assertTrue(publishedEvents().stream().anyMatch(event -> "run.cancelled".equals(event.path("event").asText())));
    }

    @Test
    void run_shouldContinueDegradedAfterRecoverableFailure() {
        behaviours.put(ReviewPhase.FETCHING_METADATA, execution -> PhaseOutcome.recoverable("scraper unreachable"));

        WorkflowResult result = engine.run(new ReviewRunRequest(RUN_ID, "25/01234/F"));

        assertEquals(RunStatus.COMPLETED, result.getStatus());
        assertEquals(7, executed.size());
        assertTrue(result.getCompletedPhases().contains(ReviewPhase.FETCHING_METADATA));
        assertEquals("scraper unreachable", result.getErrors().get(0).getError());
        assertEquals("fetching_metadata", result.getErrors().get(0).getPhase());
    }

    @Test
    void run_shouldHaltOnFatalFailureAndRetainState() throws Exception {
        behaviours.put(ReviewPhase.DOWNLOADING_DOCUMENTS, execution -> PhaseOutcome.fatal("download server rejected request"));

        WorkflowResult result = engine.run(new ReviewRunRequest(RUN_ID, "25/01234/F"));

        assertEquals(RunStatus.FAILED, result.getStatus());
        assertEquals(ReviewPhase.DOWNLOADING_DOCUMENTS, result.getFailedPhase());
        assertEquals("download server rejected request", result.getError());
        assertEquals(List.of(ReviewPhase.FETCHING_METADATA, ReviewPhase.FILTERING_DOCUMENTS), result.getCompletedPhases());
        verify(redisTemplate, never()).delete(STATE_KEY);

        JsonNode saved = lastSavedState();
        assertEquals("downloading_documents", saved.path("currentPhase").asText());
        assertEquals(2, saved.path("completedPhases").size());
        assertTrue(publishedEvents().stream().anyMatch(event -> "run.failed".equals(event.path("event").asText())));
    }

    @Test
    void run_shouldTreatUnexpectedHandlerExceptionAsFatal() {
        behaviours.put(ReviewPhase.GENERATING_REVIEW, execution -> {
            throw new IllegalStateException("template missing");
        });

        WorkflowResult result = engine.run(new ReviewRunRequest(RUN_ID, "25/01234/F"));

        assertEquals(RunStatus.FAILED, result.getStatus());
        assertEquals(ReviewPhase.GENERATING_REVIEW, result.getFailedPhase());
        assertTrue(result.getError().contains("template missing"));
        assertFalse(executed.contains(ReviewPhase.VERIFYING_REVIEW));
    }

    @Test
    void run_shouldRecordItemErrorsCarriedByOutcome() {
        behaviours.put(ReviewPhase.INGESTING_DOCUMENTS, execution -> PhaseOutcome.success(2, 3,
                List.of(new ItemError("b.pdf", "OCR failed"))));

        WorkflowResult result = engine.run(new ReviewRunRequest(RUN_ID, "25/01234/F"));

        assertEquals(RunStatus.COMPLETED, result.getStatus());
        assertEquals(1, result.getErrors().size());
        assertEquals("b.pdf", result.getErrors().get(0).getItem());
        assertEquals("ingesting_documents", result.getErrors().get(0).getPhase());
    }

    @Test
    void run_shouldPublishMonotonicProgressWithHundredOnlyAtCompletion() throws Exception {
        behaviours.put(ReviewPhase.INGESTING_DOCUMENTS, execution -> {
            FanOutResult fanOut = execution.fanOut(List.of("a.pdf", "b.pdf", "c.pdf", "d.pdf"), "Ingesting document",
                    item -> item, item -> ItemOutcome.SUCCEEDED);
            return PhaseOutcome.success(fanOut.processed(), fanOut.total(), fanOut.errors());
        });

        engine.run(new ReviewRunRequest(RUN_ID, "25/01234/F"));

        List<JsonNode> events = publishedEvents();
        int previous = -1;
        for (JsonNode event : events) {
            int percent = event.path("percentComplete").asInt();
            assertTrue(percent >= previous);
            assertEquals("run.completed".equals(event.path("event").asText()), percent == 100);
            previous = percent;
        }
        assertTrue(events.stream().anyMatch(event -> "Ingesting document 4 of 4".equals(event.path("phaseDetail").asText())));
    }

    @Test
    void run_shouldRejectMissingRunId() {
        assertThrows(IllegalArgumentException.class, () -> engine.run(new ReviewRunRequest(" ", "25/01234/F")));
    }

    private WorkflowState persistedState(ReviewPhase current, ReviewPhase... completed) {
        WorkflowState state = WorkflowState.builder()
                .runId(RUN_ID)
                .subjectId("25/01234/F")
                .startedAt(Instant.now().minusSeconds(60))
                .currentPhase(current)
                .context(ReviewRunContext.builder().applicationRef("25/01234/F").build())
                .build();
        for (ReviewPhase phase : completed) {
            state.markCompleted(phase);
        }
        return state;
    }

    private JsonNode lastSavedState() throws Exception {
        ArgumentCaptor<String> captor = ArgumentCaptor.forClass(String.class);
        verify(valueOperations, atLeastOnce()).set(eq(STATE_KEY), captor.capture(), any(Duration.class));
        List<String> values = captor.getAllValues();
        return objectMapper.readTree(values.get(values.size() - 1));
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
