package com.aigreentick.services.dealership.leads.enums;

/**
 * Letter grade on the 0..1 conversion probability. Lower bounds are inclusive.
 */
public enum ConversionGrade {

    A(0.8),
    B(0.6),
    C(0.4),
    D(0.2),
    F(0.0);

    private final double minimumProbability;

    ConversionGrade(double minimumProbability) {
        this.minimumProbability = minimumProbability;
    }

    public static ConversionGrade fromProbability(double probability) {
        for (ConversionGrade grade : values()) {
            if (probability >= grade.minimumProbability) return grade;
        }
        return F;
    }
}
