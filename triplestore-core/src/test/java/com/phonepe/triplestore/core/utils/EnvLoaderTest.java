package com.phonepe.triplestore.core.utils;

import io.github.cdimascio.dotenv.Dotenv;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class EnvLoaderTest {

    @Test
    void testReadEnvFromSystem() {
        // PATH is usually present in all environments
        assertNotNull(EnvLoader.readEnv("PATH", null));
    }

    @Test
    void testReadEnvWithDefault() {
        final var variable = "NON_EXISTENT_VAR_" + System.currentTimeMillis();
        assertEquals("default_value", EnvLoader.readEnv(variable, "default_value"));
        assertNull(EnvLoader.readEnv(variable, null));
    }

    @Test
    void testReadEnvOptional() {
        final Optional<String> result = EnvLoader.readEnv("NON_EXISTENT_VAR_" + System.currentTimeMillis());
        assertTrue(result.isEmpty());
    }

    @Test
    void testReadEnvFromDotenv() {
        final var dotenv = mock(Dotenv.class);
        when(dotenv.get("TRIPLESTORE_TEST_VAR")).thenReturn("from_file");
        assertEquals("from_file", EnvLoader.readEnv(dotenv, "TRIPLESTORE_TEST_VAR", "default"));

        final var variable = "REALLY_NON_EXISTENT_" + System.currentTimeMillis();
        assertEquals("default", EnvLoader.readEnv(dotenv, variable, "default"));
    }
}
