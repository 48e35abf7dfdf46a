package world.willfrog.review.workflow;

import world.willfrog.review.progress.ProgressTracker;

import java.util.List;
import java.util.function.Function;

/**
 * 引擎交给阶段处理器的执行句柄：累积上下文、子进度上报与 fan-out。
 */
public class PhaseExecution {

    private final String runId;
    private final ReviewPhase phase;
    private final ReviewRunContext context;
    private final ProgressTracker tracker;
    private final FanOutExecutor fanOutExecutor;
    private final int concurrency;

    public PhaseExecution(String runId,
                          ReviewPhase phase,
                          ReviewRunContext context,
                          ProgressTracker tracker,
                          FanOutExecutor fanOutExecutor,
                          int concurrency) {
        this.runId = runId;
        this.phase = phase;
        this.context = context;
        this.tracker = tracker;
        this.fanOutExecutor = fanOutExecutor;
        this.concurrency = Math.max(1, concurrency);
    }

    public String runId() {
        return runId;
    }

    public ReviewPhase phase() {
        return phase;
    }

    public ReviewRunContext context() {
        return context;
    }

    public int concurrency() {
        return concurrency;
    }

    public void reportProgress(String detail, int current, int total) {
        tracker.updateSubProgress(phase, detail, current, total);
    }

    public <T> FanOutResult fanOut(List<T> items, String verb, Function<T, String> labeler, ItemTask<T> task) {
        return fanOutExecutor.execute(items, concurrency, labeler, task, snapshot -> reportProgress(
                verb + " " + snapshot.completed() + " of " + snapshot.total(),
                snapshot.completed(),
                snapshot.total()));
    }
}
