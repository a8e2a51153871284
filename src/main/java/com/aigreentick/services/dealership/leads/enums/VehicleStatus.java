package com.aigreentick.services.dealership.leads.enums;

public enum VehicleStatus {
    AVAILABLE,
    RESERVED,
    SOLD
}
