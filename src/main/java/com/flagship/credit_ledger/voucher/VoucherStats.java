package com.flagship.credit_ledger.voucher;

import com.flagship.credit_ledger.ledger.Asset;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

@Value
public class VoucherStats {
    long total;
    long used;
    long active;
    long expired;
    Map<Asset, BigDecimal> outstandingValue;
}
