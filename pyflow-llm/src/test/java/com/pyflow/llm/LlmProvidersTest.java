package com.pyflow.llm;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class LlmProvidersTest {

    @Test
    void createsRegisteredProviderByName() {
        LlmProvider provider = LlmProviders.create("ECHO", new ProviderSettings("m-7", null, null, null));
        assertEquals("m-7", provider.modelName());
        assertEquals("hello", provider.complete("hello", null));
    }

    @Test
    void unknownNameIsConfigurationError() {
        ProviderException e = assertThrows(ProviderException.class,
                () -> LlmProviders.create("nope", ProviderSettings.defaults()));
        assertFalse(e.isTransient());
        assertEquals(-1, e.getStatusCode());
        assertTrue(e.getMessage().contains("echo"), e.getMessage());
    }

    @Test
    void availableListsDiscoveredFactories() {
        assertTrue(LlmProviders.available().contains("echo"));
    }

    @Test
    void settingsNormalizeBlanksAndHideKey() {
        ProviderSettings s = new ProviderSettings(" ", "http://host:1234//", "secret", Duration.ZERO);
        assertNull(s.model());
        assertEquals(ProviderSettings.DEFAULT_TIMEOUT, s.timeout());
        assertEquals("http://host:1234", s.baseUrlOr("http://fallback"));
        assertEquals("fallback-model", s.modelOr("fallback-model"));
        assertFalse(s.toString().contains("secret"));
    }

    @Test
    void httpStatusTransience() {
        assertTrue(ProviderException.httpStatus("p", 503, "busy").isTransient());
        assertTrue(ProviderException.httpStatus("p", 429, "").isTransient());
        assertFalse(ProviderException.httpStatus("p", 401, "denied").isTransient());
        assertEquals(401, ProviderException.httpStatus("p", 401, "denied").getStatusCode());
    }
}
