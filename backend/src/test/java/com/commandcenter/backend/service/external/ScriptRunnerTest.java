package com.commandcenter.backend.service.external;

import com.commandcenter.backend.support.TestBeans;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScriptRunnerTest {

    @TempDir
    Path dir;

    private final ScriptRunner runner = new ScriptRunner(TestBeans.objectMapper());

    @Test
    void parsesJsonFromStdout() throws Exception {
        Path script = script("echo '{\"cpu\": 12, \"disk\": {\"free\": \"40G\"}}'\necho 'noise' >&2\n");

        JsonNode out = runner.runJson(script, Duration.ofSeconds(10));

        assertThat(out.path("cpu").asInt()).isEqualTo(12);
        assertThat(out.path("disk").path("free").asText()).isEqualTo("40G");
    }

    @Test
    void slowScriptIsKilledAtTimeout() throws Exception {
        Path script = script("exec sleep 30\n");

        long start = System.nanoTime();
        assertThatThrownBy(() -> runner.runJson(script, Duration.ofMillis(300)))
                .isInstanceOf(ScriptExecutionException.class)
                .hasMessageContaining("timed out");
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(10));
    }

    @Test
    void nonJsonOutputIsAnError() throws Exception {
        Path script = script("echo 'all good'\n");

        assertThatThrownBy(() -> runner.runJson(script, Duration.ofSeconds(10)))
                .isInstanceOf(ScriptExecutionException.class)
                .hasMessageContaining("Invalid JSON");
    }

    @Test
    void emptyOutputIsAnError() throws Exception {
        Path script = script("true\n");

        assertThatThrownBy(() -> runner.runJson(script, Duration.ofSeconds(10)))
                .isInstanceOf(ScriptExecutionException.class)
                .hasMessageContaining("no output");
    }

    @Test
    void missingScriptIsAnError() {
        assertThatThrownBy(() -> runner.runJson(dir.resolve("nope.sh"), Duration.ofSeconds(1)))
                .isInstanceOf(ScriptExecutionException.class)
                .hasMessageContaining("not found");
    }

    private Path script(String body) throws Exception {
        return Files.writeString(Files.createTempFile(dir, "script-", ".sh"), "#!/usr/bin/env bash\n" + body);
    }
}
