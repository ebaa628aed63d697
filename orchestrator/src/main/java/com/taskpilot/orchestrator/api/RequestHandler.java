package com.taskpilot.orchestrator.api;

/**
 * Business logic behind one (capability, method) pair. Runs only after the
 * request has passed authorization.
 */
@FunctionalInterface
public interface RequestHandler {

    Object handle(RequestParams params);
}
