package com.polymarket.stoploss.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class OrderReceipt {
    private String orderId;
    private BigDecimal price;
    private BigDecimal size;
    private String status; // As reported at submission time
    private boolean finalSweep;
}
