package com.flagship.credit_ledger.conversion;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.List;
import java.util.Locale;

/**
 * {@link ConversionProvider} backed by the CIDMS HTTP API.
 *
 * The API answers either with a JSON object or with the bare confirmation id
 * as plain text. HTTP 400 and 403 mean the installation id is blocked or
 * invalid; 401, 429, 5xx and network failures are treated as unavailability.
 */
@Component
@Slf4j
public class CidmsConversionProvider implements ConversionProvider {

    static final int MIN_CONFIRMATION_ID_LENGTH = 10;
    private static final List<String> REJECTION_MARKERS = List.of("invalid", "failed", "blocked", "banned");

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;

    public CidmsConversionProvider(RestClient.Builder builder,
                                   ObjectMapper objectMapper,
                                   @Value("${conversion.provider.base-url:https://pidkey.com/ajax/cidms_api}") String baseUrl,
                                   @Value("${conversion.provider.api-key:}") String apiKey,
                                   @Value("${conversion.provider.timeout-ms:120000}") int timeoutMs) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(timeoutMs);
        requestFactory.setReadTimeout(timeoutMs);

        this.restClient = builder.clone()
            .baseUrl(baseUrl)
            .requestFactory(requestFactory)
            .defaultHeader(HttpHeaders.USER_AGENT, "credit-ledger")
            .build();
        this.objectMapper = objectMapper;
        this.apiKey = apiKey;
    }

    @Override
    public String convert(String installationId) {
        ResponseEntity<String> response;
        try {
            response = restClient.get()
                .uri(uri -> uri
                    .queryParam("iids", installationId)
                    .queryParam("justforcheck", 0)
                    .queryParam("apikey", apiKey)
                    .build())
                .retrieve()
                .onStatus(HttpStatusCode::isError, (request, errorResponse) -> { })
                .toEntity(String.class);
        } catch (RestClientException e) {
            log.warn("Conversion provider request failed: error={}", e.getMessage());
            throw new ProviderUnavailableException("Conversion provider request failed: " + e.getMessage(), e);
        }

        return interpret(response.getStatusCode().value(), response.getBody());
    }

    String interpret(int status, String body) {
        if (status == 400 || status == 403) {
            throw new InvalidInstallationIdException("Installation id was blocked or rejected by the provider");
        }
        if (status == 401) {
            log.error("Conversion provider rejected the API key");
            throw new ProviderUnavailableException("Conversion provider authentication failed");
        }
        if (status != 200) {
            throw new ProviderUnavailableException("Conversion provider answered HTTP " + status);
        }

        String text = body == null ? "" : body.trim();
        if (text.startsWith("{") && text.endsWith("}")) {
            return interpretJson(text);
        }

        if (text.length() < MIN_CONFIRMATION_ID_LENGTH) {
            throw new ProviderUnavailableException("Conversion provider returned a truncated response");
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (String marker : REJECTION_MARKERS) {
            if (lower.contains(marker)) {
                throw new InvalidInstallationIdException("Conversion provider refused the installation id: " + text);
            }
        }
        return text;
    }

    private String interpretJson(String text) {
        JsonNode json;
        try {
            json = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new ProviderUnavailableException("Malformed conversion provider response", e);
        }

        String confirmationId = json.path("confirmationid").asText("");
        if ("Successfully".equals(json.path("result").asText()) && !confirmationId.isBlank()) {
            return confirmationId.trim();
        }

        String error = firstText(json, "errorexecuting", "error_executing");
        long occurred = json.path("hadoccurred").asLong(json.path("had_occurred").asLong(0));
        if (error != null || occurred != 0) {
            throw new InvalidInstallationIdException("Conversion provider reported an error: "
                + (error != null ? error : "code " + occurred));
        }
        throw new ProviderUnavailableException("Unexpected conversion provider response");
    }

    private static String firstText(JsonNode json, String... fields) {
        for (String field : fields) {
            String value = json.path(field).asText("");
            if (!value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}
