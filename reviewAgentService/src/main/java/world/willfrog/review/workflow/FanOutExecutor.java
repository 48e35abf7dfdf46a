package world.willfrog.review.workflow;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import world.willfrog.review.context.ReviewContext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * 有界并发的 fan-out 执行器。
 * <p>
 * 职责：
 * 1. 在共享线程池上启动 min(concurrency, N) 个 worker，从同一队列拉取条目，保证同时在途不超过 concurrency；
 * 2. 单个条目的异常记为该条目失败，不影响其他条目；
 * 3. 每完成一个条目回调一次进度。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FanOutExecutor {

    /** 共享 fan-out 线程池。 */
    private final ExecutorService fanOutPool;

    public <T> FanOutResult execute(List<T> items,
                                    int concurrency,
                                    Function<T, String> labeler,
                                    ItemTask<T> task,
                                    Consumer<FanOutCounter.Snapshot> onProgress) {
        if (items == null || items.isEmpty()) {
            return FanOutResult.empty();
        }
        Queue<T> queue = new ConcurrentLinkedQueue<>(items);
        FanOutCounter counter = new FanOutCounter(items.size());
        List<ItemError> errors = Collections.synchronizedList(new ArrayList<>());
        int workers = Math.max(1, Math.min(concurrency, items.size()));
        String runId = ReviewContext.getRunId();
        String phase = ReviewContext.getPhase();

        List<CompletableFuture<Void>> futures = new ArrayList<>();
        for (int i = 0; i < workers; i++) {
            futures.add(CompletableFuture.runAsync(() -> {
                ReviewContext.setRunId(runId);
                ReviewContext.setPhase(phase);
                try {
                    T item;
                    while ((item = queue.poll()) != null) {
                        FanOutCounter.Snapshot snapshot = process(item, labeler, task, counter, errors);
                        notifyProgress(onProgress, snapshot);
                    }
                } finally {
                    ReviewContext.clear();
                }
            }, fanOutPool));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        FanOutCounter.Snapshot done = counter.snapshot();
        List<ItemError> collected;
        synchronized (errors) {
            collected = List.copyOf(errors);
        }
        return new FanOutResult(done.total(), done.succeeded(), done.failed(), done.skipped(), collected);
    }

    private <T> FanOutCounter.Snapshot process(T item,
                                               Function<T, String> labeler,
                                               ItemTask<T> task,
                                               FanOutCounter counter,
                                               List<ItemError> errors) {
        String label = labeler == null ? String.valueOf(item) : labeler.apply(item);
        try {
            ItemOutcome outcome = task.run(item);
            return outcome == ItemOutcome.SKIPPED ? counter.recordSkip() : counter.recordSuccess();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            errors.add(new ItemError(label, "interrupted"));
            return counter.recordFailure();
        } catch (Exception e) {
            String message = ErrorMessageExtractor.describe(e);
            log.warn("Fan-out item failed: item={}, error={}", label, message);
            errors.add(new ItemError(label, message));
            return counter.recordFailure();
        }
    }

    private void notifyProgress(Consumer<FanOutCounter.Snapshot> onProgress, FanOutCounter.Snapshot snapshot) {
        if (onProgress == null) {
            return;
        }
        try {
            onProgress.accept(snapshot);
        } catch (RuntimeException e) {
            log.warn("Fan-out progress callback failed: {}", e.getMessage());
        }
    }
}
