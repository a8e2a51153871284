package com.aigreentick.services.dealership.leads.service.impl;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.aigreentick.services.dealership.leads.dto.AssignLeadPayload;
import com.aigreentick.services.dealership.leads.enums.Urgency;
import com.aigreentick.services.dealership.leads.model.SalesRepresentative;
import com.aigreentick.services.dealership.leads.service.impl.AssignmentEngine.RepresentativeScore;

class AssignmentEngineTest {

    // Tuesday 10:00
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-14T10:00:00Z"), ZoneOffset.UTC);
    private static final LocalDateTime NOW = LocalDateTime.now(CLOCK);

    private final AssignmentEngine engine = new AssignmentEngine(CLOCK);

    @Test
    @DisplayName("Only active, available representatives inside their working hours are candidates")
    void availableNow() {
        SalesRepresentative onShift = rep(1L).build();
        SalesRepresentative inactive = rep(2L).active(false).build();
        SalesRepresentative busy = rep(3L).available(false).build();
        SalesRepresentative lateShift = rep(4L).workStartHour(12).workEndHour(20).build();
        SalesRepresentative weekendOnly = rep(5L).workDays("SATURDAY,SUNDAY").build();

        List<SalesRepresentative> candidates = engine.availableNow(
                List.of(onShift, inactive, busy, lateShift, weekendOnly));

        assertThat(candidates).extracting(SalesRepresentative::getId).containsExactly(1L);
    }

    @Test
    @DisplayName("A matching specialist outranks a loaded generalist")
    void specialistRanksFirst() {
        // given
        SalesRepresentative specialist = rep(1L)
                .vehicleExpertise("SUV,SEDAN")
                .priceCategories("PREMIUM")
                .languages("sq,en")
                .territory("Prishtina, Fushe Kosove")
                .conversionRate(new BigDecimal("35"))
                .build();
        SalesRepresentative generalist = rep(2L)
                .currentActiveLeads(10)
                .lastAssignmentAt(NOW.minusMinutes(30))
                .build();
        AssignLeadPayload lead = AssignLeadPayload.builder()
                .customerId(42L)
                .vehicleType("SUV")
                .priceRange(new BigDecimal("28000"))
                .preferredLanguage("sq")
                .location("Prishtina")
                .urgency(Urgency.HIGH)
                .leadScore(75.0)
                .build();

        // when
        List<RepresentativeScore> ranked = engine.rank(List.of(generalist, specialist), lead);

        // then
        assertThat(ranked).extracting(score -> score.representative().getId()).containsExactly(1L, 2L);
        // (30 + 25 + 20 + 15 + 35 + 15) * 1.3 + 15 top performer + 20 round robin
        assertThat(ranked.get(0).score()).isEqualTo(217);
        assertThat(ranked.get(0).reason())
                .contains("Low workload", "SUV specialist", "PREMIUM specialist", "Speaks sq",
                        "High conversion rate", "Local territory match", "High-value lead for top performer");
    }

    @Test
    @DisplayName("A representative at capacity is penalized")
    void capacityPenalty() {
        SalesRepresentative full = rep(1L).currentActiveLeads(15).lastAssignmentAt(NOW.minusMinutes(6)).build();

        RepresentativeScore score = engine.score(full, AssignLeadPayload.builder().customerId(1L).build(), NOW);

        assertThat(score.score()).isEqualTo(-50);
        assertThat(score.reason()).contains("Workload at capacity");
    }

    @Test
    @DisplayName("Urgent leads favour representatives who handle urgent requests")
    void urgentHandlerBonus() {
        SalesRepresentative urgentHandler = rep(1L).canHandleUrgent(true).build();
        SalesRepresentative regular = rep(2L).build();
        AssignLeadPayload lead = AssignLeadPayload.builder().customerId(1L).urgency(Urgency.URGENT).build();

        RepresentativeScore withBonus = engine.score(urgentHandler, lead, NOW);
        RepresentativeScore without = engine.score(regular, lead, NOW);

        assertThat(withBonus.score() - without.score()).isEqualTo(AssignmentEngine.URGENT_HANDLER_BONUS);
        assertThat(withBonus.reason()).contains("Handles urgent leads");
    }

    @Test
    @DisplayName("Territory matching is case-insensitive over the comma separated list")
    void territory() {
        SalesRepresentative rep = rep(1L).territory("Prizren, Peja").build();

        assertThat(AssignmentEngine.inTerritory(rep, "peja")).isTrue();
        assertThat(AssignmentEngine.inTerritory(rep, "Gjakova")).isFalse();
        assertThat(AssignmentEngine.inTerritory(rep, null)).isFalse();
    }

    @Test
    @DisplayName("Recommended actions follow urgency and lead score")
    void recommendedActions() {
        List<String> actions = AssignmentEngine.recommendedActions(AssignLeadPayload.builder()
                .urgency(Urgency.URGENT)
                .leadScore(90.0)
                .vehicleType("SUV")
                .build());

        assertThat(actions).containsExactly(
                "Contact lead within 15 minutes",
                "Send immediate SMS acknowledgment",
                "Prepare financing options",
                "Schedule test drive if applicable",
                "Focus on SUV inventory");
    }

    private static SalesRepresentative.SalesRepresentativeBuilder rep(Long id) {
        return SalesRepresentative.builder()
                .id(id)
                .name("Rep " + id)
                .email("rep" + id + "@autoani.com");
    }
}
