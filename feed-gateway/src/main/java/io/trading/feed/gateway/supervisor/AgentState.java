package io.trading.feed.gateway.supervisor;

/**
 * Lifecycle of a supervised agent.
 *
 * <pre>
 * CONNECTING -> STREAMING -> DISCONNECTED -> CONNECTING | FAILED | STOPPED
 * </pre>
 * FAILED and STOPPED are terminal.
 */
public enum AgentState {
    CONNECTING,
    STREAMING,
    DISCONNECTED,
    FAILED,
    STOPPED;

    public boolean isTerminal() {
        return this == FAILED || this == STOPPED;
    }
}
