package com.veriheal.core.sandbox;

import com.veriheal.core.filesystem.FileSystemManager.WorkspaceSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Runs the configured test command in a fresh temporary directory holding a
 * copy of the snapshot. The {@code {selector}} placeholder in the command is
 * replaced by the case's selector.
 */
@Component
public class ProcessSandboxRunner implements SandboxRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessSandboxRunner.class);

    public static final String SELECTOR_PLACEHOLDER = "{selector}";

    private final List<String> commandTemplate;
    private final Duration     defaultTimeout;

    @Autowired
    public ProcessSandboxRunner(
            @Value("${veriheal.sandbox.command}") String command,
            @Value("${veriheal.sandbox.timeout-seconds:60}") long timeoutSeconds
    ) {
        this(List.of(command.trim().split("\\s+")), Duration.ofSeconds(timeoutSeconds));
    }

    public ProcessSandboxRunner(List<String> commandTemplate, Duration defaultTimeout) {
        if (commandTemplate.isEmpty() || commandTemplate.get(0).isBlank()) {
            throw new IllegalArgumentException("Sandbox command is empty");
        }
        if (commandTemplate.stream().noneMatch(part -> part.contains(SELECTOR_PLACEHOLDER))) {
            throw new IllegalArgumentException("Sandbox command must contain " + SELECTOR_PLACEHOLDER);
        }
        this.commandTemplate = List.copyOf(commandTemplate);
        this.defaultTimeout  = defaultTimeout;
        log.info("[Sandbox] Command: {}, timeout: {}s", String.join(" ", commandTemplate), defaultTimeout.toSeconds());
    }

    @Override
    public Duration defaultTimeout() {
        return defaultTimeout;
    }

    @Override
    public SandboxResult run(String selector, WorkspaceSnapshot snapshot, Duration timeout)
            throws SandboxException {

        Path sandboxDir = materialise(snapshot);
        try {
            return execute(buildCommand(selector), sandboxDir, timeout);
        } finally {
            deleteRecursively(sandboxDir);
        }
    }

    List<String> buildCommand(String selector) {
        List<String> command = new ArrayList<>(commandTemplate.size());
        for (String part : commandTemplate) {
            command.add(part.replace(SELECTOR_PLACEHOLDER, selector));
        }
        return command;
    }

    // ================================================================
    // Execution
    // ================================================================

    private SandboxResult execute(List<String> command, Path directory, Duration timeout)
            throws SandboxException {

        long startTime = System.currentTimeMillis();
        log.info("[Sandbox] Executing: {}", String.join(" ", command));

        Process process;
        try {
            ProcessBuilder builder = new ProcessBuilder(command);
            builder.directory(directory.toFile());
            // merged so frame lines and error lines keep their relative order
            builder.redirectErrorStream(true);
            process = builder.start();
        } catch (IOException e) {
            throw new SandboxException("Failed to start sandbox command: " + e.getMessage(), e);
        }

        StringBuffer output = new StringBuffer();
        Thread outThread = new Thread(() -> {
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    output.append(line).append("\n");
                }
            } catch (IOException e) {
                log.warn("[Sandbox] Error reading output: {}", e.getMessage());
            }
        }, "sandbox-output");
        outThread.setDaemon(true);
        outThread.start();

        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.descendants().forEach(ProcessHandle::destroyForcibly);
                process.destroyForcibly();
                outThread.join(1000);
                log.warn("[Sandbox] Process timed out after {} seconds", timeout.toSeconds());
                return SandboxResult.timedOut(output.toString(), timeout.toSeconds(),
                        System.currentTimeMillis() - startTime);
            }
            outThread.join(1000);
        } catch (InterruptedException e) {
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new SandboxException("Interrupted while waiting for sandbox command", e);
        }

        int exitCode = process.exitValue();
        long duration = System.currentTimeMillis() - startTime;
        String merged = output.toString();

        log.info("[Sandbox] Exit code: {}, output length: {} chars, {}ms", exitCode, merged.length(), duration);

        return exitCode == 0
                ? SandboxResult.passed(merged, duration)
                : SandboxResult.failed(exitCode, merged, "", duration);
    }

    // ================================================================
    // Sandbox directory
    // ================================================================

    private Path materialise(WorkspaceSnapshot snapshot) throws SandboxException {
        Path dir = null;
        try {
            dir = Files.createTempDirectory("veriheal-sandbox-");
            for (Map.Entry<String, byte[]> entry : snapshot.getFiles().entrySet()) {
                Path target = dir.resolve(entry.getKey()).normalize();
                if (!target.startsWith(dir)) {
                    throw new SandboxException("Snapshot entry escapes sandbox: " + entry.getKey());
                }
                Files.createDirectories(target.getParent());
                Files.write(target, entry.getValue());
            }
            log.debug("[Sandbox] Materialised {} files into {}", snapshot.size(), dir);
            return dir;
        } catch (IOException e) {
            if (dir != null) deleteRecursively(dir);
            throw new SandboxException("Failed to materialise sandbox: " + e.getMessage(), e);
        } catch (SandboxException e) {
            deleteRecursively(dir);
            throw e;
        }
    }

    private void deleteRecursively(Path dir) {
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    log.warn("[Sandbox] Could not delete {}: {}", p, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.warn("[Sandbox] Could not clean up {}: {}", dir, e.getMessage());
        }
    }
}
