package com.taskpilot.orchestrator.executor.dto;

public record PullRequestResponse(String url) {}
