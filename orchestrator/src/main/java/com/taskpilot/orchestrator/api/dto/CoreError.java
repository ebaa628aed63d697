package com.taskpilot.orchestrator.api.dto;

public record CoreError(String code, String message) {}
