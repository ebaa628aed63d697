package com.taskpilot.orchestrator.executor.dto;

import java.util.List;

public record RebaseResult(boolean success, String message, List<String> conflict_files) {

    public RebaseResult {
        conflict_files = conflict_files == null ? List.of() : List.copyOf(conflict_files);
    }
}
