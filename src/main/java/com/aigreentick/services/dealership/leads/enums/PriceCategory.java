package com.aigreentick.services.dealership.leads.enums;

import java.math.BigDecimal;

public enum PriceCategory {

    BUDGET,
    MID_RANGE,
    PREMIUM,
    LUXURY;

    public static PriceCategory of(BigDecimal price) {
        if (price == null) {
            return null;
        }
        double value = price.doubleValue();
        if (value < 10_000) return BUDGET;
        if (value < 25_000) return MID_RANGE;
        if (value < 50_000) return PREMIUM;
        return LUXURY;
    }
}
