package com.aigreentick.services.dealership.common.util;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class PhoneNumbersTest {

    @ParameterizedTest
    @CsvSource({
            "'+383 49 123 456', +38349123456",
            "'383-44-123-456', +38344123456",
            "'00383 49 123 456', +38349123456",
            "'0044 20 7946 0958', +442079460958",
            "'44123456', +38344123456",
            "'049123456', +383049123456",
            "'+1 415 555 0100', +14155550100"
    })
    @DisplayName("Numbers are normalized to E.164 with +383 as the default country")
    void normalizes(String input, String expected) {
        assertThat(PhoneNumbers.normalize(input)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Mobile numbers with the 49 operator prefix get the country code")
    void operatorPrefix() {
        assertThat(PhoneNumbers.normalize("49123456789")).isEqualTo("+38349123456789");
    }

    @Test
    @DisplayName("Inputs without digits normalize to null")
    void noDigits() {
        assertThat(PhoneNumbers.normalize(null)).isNull();
        assertThat(PhoneNumbers.normalize("")).isNull();
        assertThat(PhoneNumbers.normalize("n/a")).isNull();
    }
}
