package com.chs.calculator;

import io.github.cdimascio.dotenv.Dotenv;
import io.github.cdimascio.dotenv.DotenvEntry;
import lombok.extern.slf4j.Slf4j;

/**
 * Copies the entries of a {@code .env} file into system properties before the Spring context
 * starts, so that they take part in regular property resolution ({@code SERVER_PORT},
 * {@code CALCULATOR_CORS_ALLOWED_ORIGINS}, ...).
 */
@Slf4j
public final class DotenvConfig {

    private DotenvConfig() {
    }

    /**
     * The {@code .env} file sits next to the module pom; launches from the repository root look
     * one level down.
     */
    public static String resolveDirectory(String workingDir) {
        return workingDir.endsWith("calculator") ? "./" : "./calculator";
    }

    /**
     * Loads {@code .env} from the given directory. Properties already set on the command line win.
     *
     * @return the number of entries copied into system properties
     */
    public static int load(String directory) {
        Dotenv dotenv = Dotenv.configure()
                .directory(directory)
                .ignoreIfMalformed()
                .ignoreIfMissing()
                .load();

        int applied = 0;
        for (DotenvEntry entry : dotenv.entries(Dotenv.Filter.DECLARED_IN_ENV_FILE)) {
            if (System.getProperty(entry.getKey()) == null) {
                System.setProperty(entry.getKey(), entry.getValue());
                applied++;
            }
        }

        log.info("Loaded {} .env entries from {}", applied, directory);
        return applied;
    }
}
