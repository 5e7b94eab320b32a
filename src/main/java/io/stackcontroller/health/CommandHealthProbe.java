package io.stackcontroller.health;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs a CLI check such as {@code pg_isready} or {@code redis-cli ping}; exit code 0 is healthy.
 */
@Slf4j
public class CommandHealthProbe implements HealthProbe {

    private static final int MAX_OUTPUT_CHARS = 256;

    private final List<String> command;

    public CommandHealthProbe(List<String> command) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("Probe command cannot be null or empty");
        }
        this.command = List.copyOf(command);
    }

    @Override
    public void check(Duration timeout) throws ProbeException {
        Process process;
        try {
            process = new ProcessBuilder(command).redirectErrorStream(true).start();
        } catch (IOException e) {
            throw new ProbeException("Cannot run probe command " + command + ": " + e.getMessage(), e);
        }
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new ProbeException("Probe command timed out after " + timeout.toMillis() + "ms");
            }
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                throw new ProbeException("Probe command exited with code " + exitCode + ": " + readOutput(process));
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new ProbeException("Probe interrupted", e);
        }
    }

    private String readOutput(Process process) {
        try (InputStream in = process.getInputStream()) {
            String output = new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
            return output.length() > MAX_OUTPUT_CHARS ? output.substring(0, MAX_OUTPUT_CHARS) : output;
        } catch (IOException e) {
            log.debug("Could not read probe output: {}", e.getMessage());
            return "";
        }
    }
}
