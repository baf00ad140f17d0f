package com.flagship.credit_ledger.deposit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.math.BigDecimal;

/**
 * {@link ChainLookup} backed by the Tronscan HTTP API.
 *
 * Only TRC20 transfers of the configured token contract are recognized.
 * Confirmations are derived from the latest block height reported by
 * {@code /system/status}; unconfirmed transactions report zero.
 */
@Component
@Slf4j
public class TronscanChainLookup implements ChainLookup {

    static final int DEFAULT_TOKEN_DECIMALS = 6;

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String tokenContract;

    public TronscanChainLookup(RestClient.Builder builder,
                               ObjectMapper objectMapper,
                               @Value("${chain.tronscan.base-url:https://apilist.tronscanapi.com/api}") String baseUrl,
                               @Value("${chain.tronscan.api-key:}") String apiKey,
                               @Value("${chain.tronscan.timeout-ms:15000}") int timeoutMs,
                               @Value("${deposit.token-contract:TR7NHqjeKQxGTCi8q8ZY4pL8otSzgjLj6t}") String tokenContract) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(timeoutMs);
        requestFactory.setReadTimeout(timeoutMs);

        RestClient.Builder configured = builder.clone()
            .baseUrl(baseUrl)
            .requestFactory(requestFactory);
        if (apiKey != null && !apiKey.isBlank()) {
            configured.defaultHeader("TRON-PRO-API-KEY", apiKey);
        }
        this.restClient = configured.build();
        this.objectMapper = objectMapper;
        this.tokenContract = tokenContract;
    }

    @Override
    public ChainTransfer lookup(String txHash) {
        JsonNode transaction = get("/transaction-info?hash={hash}", txHash);
        if (transaction == null || transaction.isEmpty() || !transaction.hasNonNull("hash")) {
            return ChainTransfer.notFound();
        }

        boolean confirmed = transaction.path("confirmed").asBoolean(false);
        long latestBlock = confirmed ? latestBlock() : 0L;
        return toTransfer(transaction, latestBlock);
    }

    ChainTransfer toTransfer(JsonNode transaction, long latestBlock) {
        JsonNode transfer = findTokenTransfer(transaction);
        if (transfer == null) {
            return ChainTransfer.notFound();
        }

        String quant = transfer.path("amount_str").asText(transfer.path("quant").asText(null));
        if (quant == null || quant.isBlank()) {
            throw new ChainLookupException("Token transfer without amount in transaction " + transaction.path("hash").asText());
        }

        BigDecimal amount;
        try {
            int decimals = transfer.path("decimals").asInt(DEFAULT_TOKEN_DECIMALS);
            amount = new BigDecimal(quant.trim()).movePointLeft(decimals);
        } catch (NumberFormatException e) {
            throw new ChainLookupException("Malformed token amount: " + quant, e);
        }

        long confirmations = 0;
        if (transaction.path("confirmed").asBoolean(false)) {
            long blockNumber = transaction.path("block").asLong(transaction.path("blockNumber").asLong(0));
            confirmations = Math.max(1, latestBlock - blockNumber + 1);
        }

        return ChainTransfer.of(transfer.path("to_address").asText(null), amount, confirmations);
    }

    long parseLatestBlock(JsonNode status) {
        JsonNode block = status.path("database").path("block");
        if (!block.canConvertToLong()) {
            throw new ChainLookupException("Chain status response carries no block height");
        }
        return block.asLong();
    }

    private JsonNode findTokenTransfer(JsonNode transaction) {
        JsonNode transfers = transaction.path("trc20TransferInfo");
        if (!transfers.isArray()) {
            return null;
        }
        for (JsonNode transfer : transfers) {
            if (tokenContract.equals(transfer.path("contract_address").asText())) {
                return transfer;
            }
        }
        return null;
    }

    private long latestBlock() {
        JsonNode status = get("/system/status", null);
        if (status == null) {
            throw new ChainLookupException("Empty chain status response");
        }
        return parseLatestBlock(status);
    }

    private JsonNode get(String uri, String hash) {
        String body;
        try {
            body = hash == null
                ? restClient.get().uri(uri).retrieve().body(String.class)
                : restClient.get().uri(uri, hash).retrieve().body(String.class);
        } catch (RestClientException e) {
            log.warn("Tronscan request failed: uri={}, error={}", uri, e.getMessage());
            throw new ChainLookupException("Tronscan request failed: " + e.getMessage(), e);
        }

        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ChainLookupException("Malformed Tronscan response", e);
        }
    }
}
