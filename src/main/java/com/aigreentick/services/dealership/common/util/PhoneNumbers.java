package com.aigreentick.services.dealership.common.util;

/**
 * Normalizes phone numbers to E.164. Numbers without a country code are taken
 * as Kosovo (+383) numbers.
 */
public final class PhoneNumbers {

    public static final String DEFAULT_COUNTRY_CODE = "383";

    private PhoneNumbers() {
    }

    public static String normalize(String phoneNumber) {
        if (phoneNumber == null) {
            return null;
        }
        String digits = phoneNumber.replaceAll("\\D", "");
        if (digits.isEmpty()) {
            return null;
        }

        if (digits.startsWith(DEFAULT_COUNTRY_CODE)) {
            return "+" + digits;
        }
        // mobile number written with the leading 49 operator prefix but no country code
        if (digits.startsWith("49") && digits.length() == 11) {
            return "+" + DEFAULT_COUNTRY_CODE + digits;
        }
        if (digits.startsWith("00")) {
            return "+" + digits.substring(2);
        }
        if (!phoneNumber.trim().startsWith("+") && (digits.length() == 8 || digits.length() == 9)) {
            return "+" + DEFAULT_COUNTRY_CODE + digits;
        }
        return "+" + digits;
    }
}
