package com.aigreentick.services.dealership.leads.enums;

public enum TouchpointType {

    WEBSITE_VISIT(1),
    VEHICLE_VIEW(1),
    INQUIRY(5),
    TEST_DRIVE(10),
    EMAIL_OPENED(2),
    EMAIL_CLICKED(3),
    SMS_REPLY(1);

    private final int engagementPoints;

    TouchpointType(int engagementPoints) {
        this.engagementPoints = engagementPoints;
    }

    public int getEngagementPoints() {
        return engagementPoints;
    }
}
