package com.taskpilot.orchestrator.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Writes merge events to the application log.
 */
@Component
public class MergeEventLogger {

    private static final Logger log = LoggerFactory.getLogger(MergeEventLogger.class);

    @EventListener
    public void on(MergeCompleted e) {
        log.info("Merged repo {} of workspace {} into '{}' at {}",
                e.repoId(), e.workspaceId(), e.targetBranch(), e.commitSha());
    }

    @EventListener
    public void on(MergeFailed e) {
        if (e.conflictFiles().isEmpty()) {
            log.warn("Merge failed for repo {} of workspace {}: {}", e.repoId(), e.workspaceId(), e.error());
        } else {
            log.warn("Merge failed for repo {} of workspace {} ({} conflict in {}): {}",
                    e.repoId(), e.workspaceId(), e.conflictOp(), e.conflictFiles(), e.error());
        }
    }

    @EventListener
    public void on(PRCreated e) {
        log.info("Opened pull request {} for repo {} of workspace {}", e.prUrl(), e.repoId(), e.workspaceId());
    }
}
