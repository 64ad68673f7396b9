package com.phonepe.triplestore.core.utils;

import io.github.cdimascio.dotenv.Dotenv;
import lombok.experimental.UtilityClass;

import java.util.Objects;
import java.util.Optional;

/**
 * Loads variables from the process environment, falling back to a dotenv file. The file name defaults to
 * {@code .env} in the working directory and can be changed with the {@code dotenv.file} system property.
 */
@UtilityClass
public class EnvLoader {

    /**
     * Reads a variable
     *
     * @param variable the name of the variable
     * @return the value of the variable if set
     */
    public static Optional<String> readEnv(final String variable) {
        return Optional.ofNullable(readEnv(variable, null));
    }

    /**
     * Reads a variable
     *
     * @param variable     the name of the variable
     * @param defaultValue returned when the variable is set neither in the environment nor the dotenv file
     * @return the value of the variable or the default
     */
    public static String readEnv(final String variable, final String defaultValue) {
        return readEnv(dotenv(), variable, defaultValue);
    }

    static String readEnv(final Dotenv dotenv, final String variable, final String defaultValue) {
        final var fromSystem = System.getenv(variable);
        if (fromSystem != null) {
            return fromSystem;
        }
        return Objects.requireNonNullElse(dotenv.get(variable), defaultValue);
    }

    private static Dotenv dotenv() {
        return Dotenv.configure()
                .filename(System.getProperty("dotenv.file", ".env"))
                .ignoreIfMissing()
                .ignoreIfMalformed()
                .load();
    }
}
