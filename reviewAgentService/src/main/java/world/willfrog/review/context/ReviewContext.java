package world.willfrog.review.context;

import org.slf4j.MDC;

/**
 * 当前线程的 run 上下文，同步写入 MDC 供日志输出 runId / phase。
 */
public class ReviewContext {
    public static final String MDC_RUN_ID = "runId";
    public static final String MDC_PHASE = "phase";

    private static final ThreadLocal<String> RUN_ID_HOLDER = new ThreadLocal<>();
    private static final ThreadLocal<String> PHASE_HOLDER = new ThreadLocal<>();

    public static void setRunId(String runId) {
        RUN_ID_HOLDER.set(runId);
        if (runId == null) {
            MDC.remove(MDC_RUN_ID);
        } else {
            MDC.put(MDC_RUN_ID, runId);
        }
    }

    public static String getRunId() {
        return RUN_ID_HOLDER.get();
    }

    public static void setPhase(String phase) {
        PHASE_HOLDER.set(phase);
        if (phase == null) {
            MDC.remove(MDC_PHASE);
        } else {
            MDC.put(MDC_PHASE, phase);
        }
    }

    public static String getPhase() {
        return PHASE_HOLDER.get();
    }

    public static void clear() {
        RUN_ID_HOLDER.remove();
        PHASE_HOLDER.remove();
        MDC.remove(MDC_RUN_ID);
        MDC.remove(MDC_PHASE);
    }
}
