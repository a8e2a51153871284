package com.aigreentick.services.dealership.leads.service.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.aigreentick.services.dealership.leads.dto.ScoreResult;
import com.aigreentick.services.dealership.leads.enums.FuelType;
import com.aigreentick.services.dealership.leads.enums.InquiryStatus;
import com.aigreentick.services.dealership.leads.enums.InquiryType;
import com.aigreentick.services.dealership.leads.enums.QualificationLevel;
import com.aigreentick.services.dealership.leads.model.Inquiry;
import com.aigreentick.services.dealership.leads.model.Vehicle;

class InquiryScoringModelTest {

    // Sunday
    private static final LocalDateTime SUNDAY_2AM = LocalDateTime.of(2024, 5, 12, 2, 0);

    private final InquiryScoringModel model = new InquiryScoringModel();

    @Test
    @DisplayName("General night-time inquiry with an email only lands in WARM")
    void generalNightInquiryIsWarm() {
        // given
        Inquiry inquiry = Inquiry.builder()
                .type(InquiryType.GENERAL)
                .email("arben@example.com")
                .createdAt(SUNDAY_2AM)
                .build();
        LocalDateTime now = SUNDAY_2AM.plusMinutes(90);

        // when
        Map<String, Double> raw = model.rawFactors(inquiry, null, null, now);
        Map<String, Double> weighted = model.weigh(raw);
        double total = weighted.values().stream().mapToDouble(Double::doubleValue).sum();
        ScoreResult result = ScoringEngine.assemble(total, 100.0, weighted, List.of());

        // then
        assertThat(raw).containsEntry("inquiryType", 30.0)
                .containsEntry("contactCompleteness", 30.0)
                .containsEntry("responseTime", 80.0)
                .containsEntry("vehicleAppeal", 50.0)
                .containsEntry("timing", 65.0);
        assertThat(total).isCloseTo(49.0, within(0.001));
        assertThat(result.scorePercentage()).isEqualTo(49.0);
        assertThat(result.qualificationLevel()).isEqualTo(QualificationLevel.WARM);
    }

    @Test
    @DisplayName("Response time is measured up to the response once the inquiry was answered")
    void responseTimeUsesRespondedAt() {
        Inquiry answered = Inquiry.builder()
                .type(InquiryType.TEST_DRIVE)
                .createdAt(SUNDAY_2AM)
                .status(InquiryStatus.RESPONDED)
                .respondedAt(SUNDAY_2AM.plusMinutes(30))
                .build();
        Inquiry pending = Inquiry.builder()
                .type(InquiryType.TEST_DRIVE)
                .createdAt(SUNDAY_2AM)
                .build();

        LocalDateTime fourDaysLater = SUNDAY_2AM.plusDays(4);

        assertThat(InquiryScoringModel.responseTimeScore(answered, fourDaysLater)).isEqualTo(100.0);
        assertThat(InquiryScoringModel.responseTimeScore(pending, fourDaysLater)).isEqualTo(30.0);
        assertThat(InquiryScoringModel.responseTimeScore(pending, SUNDAY_2AM.plusHours(30))).isEqualTo(60.0);
    }

    @Test
    @DisplayName("Response time bands switch exactly on the hour marks")
    void responseTimeBandEdges() {
        Inquiry pending = Inquiry.builder()
                .type(InquiryType.GENERAL)
                .createdAt(SUNDAY_2AM)
                .build();

        assertThat(InquiryScoringModel.responseTimeScore(pending, SUNDAY_2AM.plusSeconds(59))).isEqualTo(100.0);
        assertThat(InquiryScoringModel.responseTimeScore(pending, SUNDAY_2AM.plusSeconds(3599))).isEqualTo(100.0);
        assertThat(InquiryScoringModel.responseTimeScore(pending, SUNDAY_2AM.plusHours(1))).isEqualTo(80.0);
        assertThat(InquiryScoringModel.responseTimeScore(pending, SUNDAY_2AM.plusHours(24).minusSeconds(1)))
                .isEqualTo(80.0);
        assertThat(InquiryScoringModel.responseTimeScore(pending, SUNDAY_2AM.plusHours(24))).isEqualTo(60.0);
        assertThat(InquiryScoringModel.responseTimeScore(pending, SUNDAY_2AM.plusHours(72))).isEqualTo(30.0);
    }

    @Test
    @DisplayName("Complete contact details score 100")
    void fullContactDetails() {
        Inquiry inquiry = Inquiry.builder()
                .type(InquiryType.PURCHASE_INTENT)
                .name("Arben Krasniqi")
                .email("arben@example.com")
                .phone("+38349123456")
                .message("I would like to buy the Golf this week if possible")
                .createdAt(SUNDAY_2AM)
                .build();

        assertThat(InquiryScoringModel.completenessScore(inquiry)).isEqualTo(100.0);
        assertThat(InquiryScoringModel.inquiryTypeScore(inquiry)).isEqualTo(90.0);
    }

    @Test
    @DisplayName("Weekday business hours earn the full timing bonus")
    void weekdayBusinessHours() {
        // Tuesday 10:00
        Inquiry inquiry = Inquiry.builder()
                .type(InquiryType.GENERAL)
                .createdAt(LocalDateTime.of(2024, 5, 14, 10, 0))
                .build();

        assertThat(InquiryScoringModel.timingScore(inquiry, LocalDateTime.of(2024, 5, 14, 11, 0))).isEqualTo(100.0);
        assertThat(InquiryScoringModel.timingScore(inquiry, LocalDateTime.of(2024, 5, 16, 11, 0))).isEqualTo(85.0);
    }

    @Test
    @DisplayName("Vehicle appeal is capped at 100")
    void vehicleAppealCapped() {
        LocalDateTime now = LocalDateTime.of(2024, 5, 14, 10, 0);
        Vehicle vehicle = Vehicle.builder()
                .make("Volkswagen")
                .model("ID.4")
                .year(2024)
                .price(new BigDecimal("32000"))
                .mileage(12_000)
                .fuelType(FuelType.ELECTRIC)
                .viewCount(400)
                .inquiryCount(6)
                .build();

        assertThat(InquiryScoringModel.vehicleAppealScore(vehicle, 40_000.0, now)).isEqualTo(100.0);
        assertThat(InquiryScoringModel.vehicleAppealScore(null, null, now)).isEqualTo(50.0);
    }

    @Test
    @DisplayName("Overpriced older stock loses appeal")
    void overpricedVehicle() {
        LocalDateTime now = LocalDateTime.of(2024, 5, 14, 10, 0);
        Vehicle vehicle = Vehicle.builder()
                .make("Audi")
                .model("A4")
                .year(2015)
                .price(new BigDecimal("15000"))
                .mileage(180_000)
                .fuelType(FuelType.DIESEL)
                .build();

        // 50 - 10 for a price 25% above similar stock
        assertThat(InquiryScoringModel.vehicleAppealScore(vehicle, 12_000.0, now)).isEqualTo(40.0);
    }
}
