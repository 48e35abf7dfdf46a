package world.willfrog.review.mcp;

import java.util.Collection;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 单个 server 的连接状态，进程生命周期内常驻。
 * <p>
 * 字段各自独立可见（volatile / atomic），不保证跨字段的一致快照；读方通过 {@link #snapshot()} 获取拷贝。
 * 只有 ToolInvoker 可以修改。
 */
public class ServerConnectionState {

    private final String serverName;
    private volatile boolean connected;
    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private volatile String lastError;
    private volatile Set<String> availableTools = Set.of();

    public ServerConnectionState(String serverName) {
        this.serverName = serverName;
    }

    public String getServerName() {
        return serverName;
    }

    public boolean isConnected() {
        return connected;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }

    public String getLastError() {
        return lastError;
    }

    public Set<String> getAvailableTools() {
        return availableTools;
    }

    void markSuccess() {
        consecutiveFailures.set(0);
        lastError = null;
        connected = true;
    }

    void markFailure(String error, boolean disconnect) {
        consecutiveFailures.incrementAndGet();
        lastError = error;
        if (disconnect) {
            connected = false;
        }
    }

    void updateTools(Collection<String> tools) {
        availableTools = tools == null ? Set.of() : Set.copyOf(tools);
    }

    public Snapshot snapshot() {
        return new Snapshot(serverName, connected, consecutiveFailures.get(), lastError, availableTools);
    }

    public record Snapshot(String serverName,
                           boolean connected,
                           int consecutiveFailures,
                           String lastError,
                           Set<String> availableTools) {
    }
}
