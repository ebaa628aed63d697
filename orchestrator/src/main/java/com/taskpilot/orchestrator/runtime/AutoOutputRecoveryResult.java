package com.taskpilot.orchestrator.runtime;

public record AutoOutputRecoveryResult(boolean success, String message) {

    public static AutoOutputRecoveryResult ok(String message)     { return new AutoOutputRecoveryResult(true, message); }
    public static AutoOutputRecoveryResult failed(String message) { return new AutoOutputRecoveryResult(false, message); }
}
