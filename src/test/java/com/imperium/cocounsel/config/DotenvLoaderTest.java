package com.imperium.cocounsel.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class DotenvLoaderTest {

    @TempDir
    Path dir;

    @AfterEach
    void clearProperties() {
        System.clearProperty("COCOUNSEL_TEST_HOST");
        System.clearProperty("COCOUNSEL_TEST_QUOTED");
        System.clearProperty("COCOUNSEL_TEST_EXISTING");
        System.clearProperty("OPENAI_BASE_URL");
    }

    @Test
    void loadsKeyValuesWithoutOverriding() throws IOException {
        System.setProperty("COCOUNSEL_TEST_EXISTING", "keep");
        Path env = dir.resolve(".env");
        Files.writeString(env, """
                # comment
                COCOUNSEL_TEST_HOST=localhost
                export COCOUNSEL_TEST_QUOTED="with spaces"
                COCOUNSEL_TEST_EXISTING=overwritten
                not a pair
                OPENAI_BASE_URL=https://api.example.com/v1/
                """);

        DotenvLoader.load(env);

        assertThat(System.getProperty("COCOUNSEL_TEST_HOST")).isEqualTo("localhost");
        assertThat(System.getProperty("COCOUNSEL_TEST_QUOTED")).isEqualTo("with spaces");
        assertThat(System.getProperty("COCOUNSEL_TEST_EXISTING")).isEqualTo("keep");
        assertThat(System.getProperty("OPENAI_BASE_URL")).isEqualTo("https://api.example.com");
    }

    @Test
    void missingFileIsIgnored() {
        DotenvLoader.load(dir.resolve("absent.env"));

        assertThat(System.getProperty("COCOUNSEL_TEST_HOST")).isNull();
    }

    @Test
    void secretsAreDetectedByName() {
        assertThat(DotenvLoader.isSecret("OPENAI_API_KEY")).isTrue();
        assertThat(DotenvLoader.isSecret("mysql_password")).isTrue();
        assertThat(DotenvLoader.isSecret("QDRANT_HOST")).isFalse();
    }
}
