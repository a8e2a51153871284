package com.aigreentick.services.dealership.leads.enums;

public enum FuelType {
    PETROL,
    DIESEL,
    HYBRID,
    ELECTRIC,
    LPG;

    public boolean isAlternative() {
        return this == HYBRID || this == ELECTRIC;
    }
}
