package com.taskpilot.orchestrator.executor.dto;

public record GitStatusResponse(boolean uncommitted) {}
