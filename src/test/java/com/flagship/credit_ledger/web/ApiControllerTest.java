package com.flagship.credit_ledger.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.credit_ledger.ledger.Asset;
import com.flagship.credit_ledger.voucher.VoucherRegistry;
import com.flagship.credit_ledger.voucher.VoucherValue;
import com.flagship.credit_ledger.web.dto.AdjustBalanceRequest;
import com.flagship.credit_ledger.web.dto.ConversionRequest;
import com.flagship.credit_ledger.web.dto.RedeemVoucherRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.UUID;

import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * HTTP surface: status codes, error bodies and required headers.
 */
@SpringBootTest
@AutoConfigureMockMvc
class ApiControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private VoucherRegistry voucherRegistry;

    @Test
    @DisplayName("Unknown account is 404 with an error body")
    void unknownAccount() throws Exception {
        mockMvc.perform(get("/api/accounts/{userKey}", "nobody-" + UUID.randomUUID()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Not Found"));
    }

    @Test
    @DisplayName("Redeeming a voucher twice answers 200 then 409")
    void voucherRedeemedTwice() throws Exception {
        String code = "WEB-" + UUID.randomUUID().toString().substring(0, 8).toUpperCase(Locale.ROOT);
        voucherRegistry.createWithCode(code, VoucherValue.of(Asset.CREDITS, new BigDecimal("20")), null, "admin-test");
        String userKey = "web-" + UUID.randomUUID();

        String body = objectMapper.writeValueAsString(RedeemVoucherRequest.builder()
                .userKey(userKey)
                .code(code)
                .build());

        mockMvc.perform(post("/api/vouchers/redeem").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.kind").value("VOUCHER_CREDIT"))
                .andExpect(jsonPath("$.external_reference").value(code));

        mockMvc.perform(post("/api/vouchers/redeem").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isConflict());

        mockMvc.perform(get("/api/accounts/{userKey}", userKey))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.user_key").value(userKey))
                .andExpect(jsonPath("$.credit_balance").isNumber());
    }

    @Test
    @DisplayName("Conversion without Idempotency-Key header is 400")
    void conversionRequiresIdempotencyKey() throws Exception {
        String body = objectMapper.writeValueAsString(ConversionRequest.builder()
                .userKey("web-" + UUID.randomUUID())
                .installationId("1234567".repeat(9))
                .build());

        mockMvc.perform(post("/api/conversions").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Missing Required Header"));
    }

    @Test
    @DisplayName("Malformed installation id is 400")
    void malformedInstallationId() throws Exception {
        String body = objectMapper.writeValueAsString(ConversionRequest.builder()
                .userKey("web-" + UUID.randomUUID())
                .installationId("12-34")
                .build());

        mockMvc.perform(post("/api/conversions")
                        .header("Idempotency-Key", UUID.randomUUID().toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Package list carries the catalog version and packages")
    void packageList() throws Exception {
        mockMvc.perform(get("/api/packages"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.version").isNumber())
                .andExpect(jsonPath("$.packages[*].package_id").value(hasItem("large")));
    }

    @Test
    @DisplayName("Purchase without funds is 402 and an unknown package is 404")
    void purchaseFailures() throws Exception {
        String body = "{\"user_key\":\"web-" + UUID.randomUUID() + "\"}";

        mockMvc.perform(post("/api/packages/{id}/purchase", "large").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isPaymentRequired())
                .andExpect(jsonPath("$.details.asset").value("FUNDS"));

        mockMvc.perform(post("/api/packages/{id}/purchase", "nonexistent").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Admin adjustment requires the admin header and an existing account")
    void adminAdjustment() throws Exception {
        String userKey = "web-admin-" + UUID.randomUUID();
        String body = objectMapper.writeValueAsString(AdjustBalanceRequest.builder()
                .userKey(userKey)
                .asset(Asset.FUNDS)
                .amount(new BigDecimal("10.00"))
                .reason("goodwill")
                .build());

        mockMvc.perform(post("/api/admin/adjustments").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest());

        mockMvc.perform(post("/api/admin/adjustments")
                        .header("X-Admin-Key", "ops")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isNotFound());

        mockMvc.perform(post("/api/deposits").contentType(MediaType.APPLICATION_JSON).content("{not json"))
                .andExpect(status().isBadRequest());
    }
}
