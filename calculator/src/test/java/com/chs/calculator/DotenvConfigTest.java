package com.chs.calculator;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class DotenvConfigTest {

    private static final String FRESH_KEY = "DOTENV_CONFIG_TEST_FRESH";
    private static final String PRESET_KEY = "DOTENV_CONFIG_TEST_PRESET";

    @TempDir
    Path dir;

    @AfterEach
    void clearProperties() {
        System.clearProperty(FRESH_KEY);
        System.clearProperty(PRESET_KEY);
    }

    @Test
    void copiesEntriesIntoSystemProperties() throws IOException {
        Files.writeString(dir.resolve(".env"), FRESH_KEY + "=9000\n");

        int applied = DotenvConfig.load(dir.toString());

        assertThat(applied).isEqualTo(1);
        assertThat(System.getProperty(FRESH_KEY)).isEqualTo("9000");
    }

    @Test
    void keepsPropertiesAlreadySet() throws IOException {
        System.setProperty(PRESET_KEY, "from-command-line");
        Files.writeString(dir.resolve(".env"), PRESET_KEY + "=from-env-file\n" + FRESH_KEY + "=1\n");

        int applied = DotenvConfig.load(dir.toString());

        assertThat(applied).isEqualTo(1);
        assertThat(System.getProperty(PRESET_KEY)).isEqualTo("from-command-line");
    }

    @Test
    void moduleDirectoryReadsLocalFile() {
        assertThat(DotenvConfig.resolveDirectory("/home/dev/home/calculator")).isEqualTo("./");
    }

    @Test
    void repositoryRootLooksInModule() {
        assertThat(DotenvConfig.resolveDirectory("/home/dev/home")).isEqualTo("./calculator");
    }

    @Test
    void missingFileIsIgnored() {
        assertThat(DotenvConfig.load(dir.toString())).isZero();
    }
}
