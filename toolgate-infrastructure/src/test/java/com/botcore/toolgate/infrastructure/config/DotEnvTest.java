package com.botcore.toolgate.infrastructure.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DotEnvTest {

    @TempDir
    Path dir;

    @Test
    void missingFileGivesEmptyMap() throws Exception {
        assertThat(DotEnv.loadIfExists(dir.resolve(".env"))).isEmpty();
        assertThat(DotEnv.loadIfExists(null)).isEmpty();
    }

    @Test
    void parsesCommentsQuotesAndExport() throws Exception {
        Path f = dir.resolve(".env");
        Files.writeString(f, String.join("\n",
                "# comment",
                "",
                "BOTCORE_EMAIL=bot@example.com",
                "export TOOLGATE_AUTH_TOKEN=\"abc=def\"",
                "RUST_API_URL = 'http://engine:8080' ",
                "=novalue",
                "garbage"));

        Map<String, String> env = DotEnv.loadIfExists(f);

        assertThat(env).containsExactly(
                Map.entry("BOTCORE_EMAIL", "bot@example.com"),
                Map.entry("TOOLGATE_AUTH_TOKEN", "abc=def"),
                Map.entry("RUST_API_URL", "http://engine:8080"));
    }
}
