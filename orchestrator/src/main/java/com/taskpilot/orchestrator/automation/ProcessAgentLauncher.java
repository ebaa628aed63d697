package com.taskpilot.orchestrator.automation;

import com.taskpilot.orchestrator.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Runs the configured agent command as a local process.
 *
 * The task prompt is passed as the last argument. stderr is merged into
 * stdout so the output view sees both.
 */
@Component
public class ProcessAgentLauncher implements AgentLauncher {

    private static final Logger log = LoggerFactory.getLogger(ProcessAgentLauncher.class);

    private final List<String> command;

    public ProcessAgentLauncher(@Value("${taskpilot.automation.agent-command:claude --print}") String command) {
        this.command = Arrays.stream(command.trim().split("\\s+"))
                .filter(s -> !s.isEmpty())
                .toList();
        if (this.command.isEmpty()) {
            throw new IllegalArgumentException("taskpilot.automation.agent-command must not be blank");
        }
    }

    @Override
    public AgentProcess launch(Task task, Path worktree) throws IOException {
        List<String> argv = new ArrayList<>(command);
        argv.add(prompt(task));

        Process process = new ProcessBuilder(argv)
                .directory(worktree.toFile())
                .redirectErrorStream(true)
                .start();
        String id = "agent-" + UUID.randomUUID().toString().substring(0, 8);
        log.info("Launched {} for task {} in {} (pid={})", id, task.shortId(), worktree, process.pid());
        return new LocalAgentProcess(id, process);
    }

    static String prompt(Task task) {
        StringBuilder sb = new StringBuilder(task.getTitle());
        if (task.getDescription() != null && !task.getDescription().isBlank()) {
            sb.append("\n\n").append(task.getDescription());
        }
        if (task.getScratchpad() != null && !task.getScratchpad().isBlank()) {
            sb.append("\n\nNotes from previous runs:\n").append(task.getScratchpad());
        }
        return sb.toString();
    }

    private record LocalAgentProcess(String id, Process process) implements AgentProcess {

        @Override
        public void forEachOutputLine(Consumer<String> consumer) throws IOException {
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    consumer.accept(line);
                }
            }
        }

        @Override
        public int waitFor() throws InterruptedException {
            return process.waitFor();
        }

        @Override
        public void kill() {
            process.descendants().forEach(ProcessHandle::destroy);
            process.destroy();
        }
    }
}
