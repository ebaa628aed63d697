package com.taskpilot.orchestrator.automation;

import java.io.IOException;
import java.util.function.Consumer;

/**
 * A launched agent, as seen by the scheduler.
 */
public interface AgentProcess {

    /** Stable id; becomes the registry's {@code AgentHandle}. */
    String id();

    /** Feed every output line to the consumer. Returns when the output stream closes. */
    void forEachOutputLine(Consumer<String> consumer) throws IOException;

    /** Block until the agent exits; returns its exit code. */
    int waitFor() throws InterruptedException;

    void kill();
}
