package com.commandcenter.backend.service.external;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a shell script under bash and parses its stdout as JSON. The process is killed when it
 * outlives the timeout.
 */
@Component
public class ScriptRunner {

    private static final Logger log = LoggerFactory.getLogger(ScriptRunner.class);

    private final ObjectMapper om;

    public ScriptRunner(ObjectMapper om) {
        this.om = om;
    }

    public JsonNode runJson(Path script, Duration timeout) {
        if (!Files.isRegularFile(script)) {
            throw new ScriptExecutionException("Script not found: " + script);
        }

        Process process;
        try {
            process = new ProcessBuilder("bash", script.toString())
                    .redirectError(ProcessBuilder.Redirect.DISCARD)
                    .start();
        } catch (IOException e) {
            throw new ScriptExecutionException("Failed to start " + script.getFileName() + ": " + e.getMessage(), e);
        }

        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()));
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                log.warn("Script {} timed out after {}s", script, timeout.toSeconds());
                throw new ScriptExecutionException(script.getFileName() + " timed out after " + timeout.toSeconds() + "s");
            }
            String output = stdout.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (output.isBlank()) {
                throw new ScriptExecutionException(script.getFileName() + " produced no output");
            }
            return om.readTree(output);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new ScriptExecutionException("Interrupted while running " + script.getFileName(), e);
        } catch (JsonProcessingException e) {
            log.warn("Script {} produced invalid JSON: {}", script, e.getOriginalMessage());
            throw new ScriptExecutionException("Invalid JSON from " + script.getFileName() + ": " + e.getOriginalMessage(), e);
        } catch (ExecutionException | TimeoutException e) {
            throw new ScriptExecutionException("Failed to read output of " + script.getFileName(), e);
        }
    }

    private static String readAll(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
