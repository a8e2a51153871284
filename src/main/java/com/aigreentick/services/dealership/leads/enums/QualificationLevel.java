package com.aigreentick.services.dealership.leads.enums;

/**
 * Lead bucket derived from the score percentage. Lower bounds are inclusive.
 */
public enum QualificationLevel {

    QUALIFIED(80.0),
    HOT(60.0),
    WARM(40.0),
    COLD(0.0);

    private final double minimumPercentage;

    QualificationLevel(double minimumPercentage) {
        this.minimumPercentage = minimumPercentage;
    }

    public double getMinimumPercentage() {
        return minimumPercentage;
    }

    public static QualificationLevel fromPercentage(double percentage) {
        for (QualificationLevel level : values()) {
            if (percentage >= level.minimumPercentage) return level;
        }
        return COLD;
    }

    public boolean triggersAssignment() {
        return this == QUALIFIED || this == HOT;
    }
}
