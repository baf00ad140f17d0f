package com.flagship.credit_ledger.conversion;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestClient;

import static org.junit.jupiter.api.Assertions.*;

class CidmsConversionProviderTest {

    private final CidmsConversionProvider provider = new CidmsConversionProvider(
            RestClient.builder(), new ObjectMapper(), "http://localhost", "key", 1000);

    @Test
    @DisplayName("JSON success yields the confirmation id")
    void jsonSuccess() {
        String id = provider.interpret(200, "{\"result\":\"Successfully\",\"confirmationid\":\" 123456-789012-345678 \"}");

        assertEquals("123456-789012-345678", id);
    }

    @Test
    @DisplayName("JSON error report means the installation id is refused")
    void jsonErrorReport() {
        assertThrows(InvalidInstallationIdException.class, () ->
                provider.interpret(200, "{\"result\":\"\",\"errorexecuting\":\"0x7F\"}"));
        assertThrows(InvalidInstallationIdException.class, () ->
                provider.interpret(200, "{\"had_occurred\":3}"));
    }

    @Test
    @DisplayName("JSON without result or error is treated as unavailability")
    void jsonUnexpected() {
        assertThrows(ProviderUnavailableException.class, () -> provider.interpret(200, "{\"status\":\"queued\"}"));
    }

    @Test
    @DisplayName("Plain-text answers")
    void plainText() {
        assertEquals("112233445566778899", provider.interpret(200, "112233445566778899\n"));
        assertThrows(InvalidInstallationIdException.class, () -> provider.interpret(200, "Installation ID is BLOCKED"));
        assertThrows(ProviderUnavailableException.class, () -> provider.interpret(200, "short"));
        assertThrows(ProviderUnavailableException.class, () -> provider.interpret(200, null));
    }

    @Test
    @DisplayName("HTTP status mapping")
    void statusMapping() {
        assertThrows(InvalidInstallationIdException.class, () -> provider.interpret(400, ""));
        assertThrows(InvalidInstallationIdException.class, () -> provider.interpret(403, ""));
        assertThrows(ProviderUnavailableException.class, () -> provider.interpret(401, ""));
        assertThrows(ProviderUnavailableException.class, () -> provider.interpret(429, ""));
        assertThrows(ProviderUnavailableException.class, () -> provider.interpret(503, "Service Unavailable"));
    }
}
