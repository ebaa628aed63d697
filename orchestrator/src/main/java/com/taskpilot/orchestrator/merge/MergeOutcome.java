package com.taskpilot.orchestrator.merge;

/**
 * Result of a task-level merge operation. Failures carry a human-readable
 * explanation rather than an error code.
 */
public record MergeOutcome(boolean success, String message) {

    static final int MAX_MESSAGE_LENGTH = 500;

    public static MergeOutcome ok(String message) {
        return new MergeOutcome(true, message);
    }

    public static MergeOutcome failed(String message) {
        return new MergeOutcome(false, truncate(message));
    }

    static String truncate(String message) {
        if (message == null) return "";
        return message.length() <= MAX_MESSAGE_LENGTH ? message : message.substring(0, MAX_MESSAGE_LENGTH);
    }
}
