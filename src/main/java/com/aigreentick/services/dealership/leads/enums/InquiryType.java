package com.aigreentick.services.dealership.leads.enums;

public enum InquiryType {

    PURCHASE_INTENT(90),
    FINANCING(80),
    TEST_DRIVE(70),
    TRADE_IN(60),
    PRICE_INQUIRY(50),
    GENERAL(30);

    private final int intentScore;

    InquiryType(int intentScore) {
        this.intentScore = intentScore;
    }

    public int getIntentScore() {
        return intentScore;
    }
}
