package com.aigreentick.services.dealership.leads.service.impl;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

import org.springframework.stereotype.Component;

import com.aigreentick.services.dealership.leads.dto.AssignLeadPayload;
import com.aigreentick.services.dealership.leads.enums.PriceCategory;
import com.aigreentick.services.dealership.leads.enums.Urgency;
import com.aigreentick.services.dealership.leads.model.SalesRepresentative;

import lombok.RequiredArgsConstructor;

/**
 * Ranks sales representatives for a lead. Pure computation over the candidates it
 * is given; persistence and side effects live in {@link LeadAssignmentService}.
 */
@Component
@RequiredArgsConstructor
public class AssignmentEngine {

    static final double WORKLOAD_WEIGHT = 0.3;
    static final int CAPACITY_PENALTY = 50;
    static final int VEHICLE_EXPERTISE_BONUS = 25;
    static final int PRICE_EXPERTISE_BONUS = 20;
    static final int LANGUAGE_BONUS = 15;
    static final int TERRITORY_BONUS = 15;
    static final int URGENT_HANDLER_BONUS = 20;
    static final int TOP_PERFORMER_BONUS = 15;
    static final int RECENTLY_ACTIVE_BONUS = 10;
    static final double MAX_ROUND_ROBIN_BONUS = 20;
    // hours credited to a representative who never had a lead
    static final double NEVER_ASSIGNED_HOURS = 999;

    private final Clock clock;

    public record RepresentativeScore(SalesRepresentative representative, long score, String reason) {
    }

    /**
     * Representatives that are active, available and inside their working hours.
     */
    public List<SalesRepresentative> availableNow(List<SalesRepresentative> representatives) {
        LocalDateTime now = LocalDateTime.now(clock);
        String day = now.getDayOfWeek().name();
        int hour = now.getHour();

        return representatives.stream()
                .filter(SalesRepresentative::isActive)
                .filter(SalesRepresentative::isAvailable)
                .filter(rep -> rep.worksOn(day))
                .filter(rep -> hour >= rep.getWorkStartHour() && hour <= rep.getWorkEndHour())
                .toList();
    }

    /**
     * Scores every candidate, best first.
     */
    public List<RepresentativeScore> rank(List<SalesRepresentative> candidates, AssignLeadPayload lead) {
        LocalDateTime now = LocalDateTime.now(clock);
        return candidates.stream()
                .map(rep -> score(rep, lead, now))
                .sorted(Comparator.comparingLong(RepresentativeScore::score).reversed())
                .toList();
    }

    RepresentativeScore score(SalesRepresentative rep, AssignLeadPayload lead, LocalDateTime now) {
        double score = 0;
        List<String> reasons = new ArrayList<>();

        int load = rep.getCurrentActiveLeads();
        int capacity = Math.max(1, rep.getMaxActiveLeads());
        score += Math.max(0, 100 - (double) load / capacity * 100) * WORKLOAD_WEIGHT;
        if (load < capacity * 0.5) {
            reasons.add("Low workload");
        } else if (load >= capacity) {
            score -= CAPACITY_PENALTY;
            reasons.add("Workload at capacity");
        }

        if (lead.getVehicleType() != null && rep.hasExpertise(lead.getVehicleType())) {
            score += VEHICLE_EXPERTISE_BONUS;
            reasons.add(lead.getVehicleType() + " specialist");
        }

        if (lead.getPriceRange() != null) {
            PriceCategory category = PriceCategory.of(lead.getPriceRange());
            if (rep.handlesPriceCategory(category.name())) {
                score += PRICE_EXPERTISE_BONUS;
                reasons.add(category.name() + " specialist");
            }
        }

        if (lead.getPreferredLanguage() != null && rep.speaks(lead.getPreferredLanguage())) {
            score += LANGUAGE_BONUS;
            reasons.add("Speaks " + lead.getPreferredLanguage());
        }

        double conversionRate = rep.getConversionRate() == null ? 0 : rep.getConversionRate().doubleValue();
        score += conversionRate;
        if (conversionRate > 30) {
            reasons.add("High conversion rate");
        }

        if (inTerritory(rep, lead.getLocation())) {
            score += TERRITORY_BONUS;
            reasons.add("Local territory match");
        }

        Urgency urgency = lead.getUrgency() == null ? Urgency.LOW : lead.getUrgency();
        score *= urgency.getScoreMultiplier();
        if (urgency == Urgency.URGENT && rep.isCanHandleUrgent()) {
            score += URGENT_HANDLER_BONUS;
            reasons.add("Handles urgent leads");
        }

        if (lead.getLeadScore() != null && lead.getLeadScore() > 70 && conversionRate > 25) {
            score += TOP_PERFORMER_BONUS;
            reasons.add("High-value lead for top performer");
        }

        if (rep.getLastActiveAt() != null && Duration.between(rep.getLastActiveAt(), now).toMinutes() < 60) {
            score += RECENTLY_ACTIVE_BONUS;
            reasons.add("Recently active");
        }

        double hoursWaiting = rep.getLastAssignmentAt() == null
                ? NEVER_ASSIGNED_HOURS
                : Duration.between(rep.getLastAssignmentAt(), now).toMinutes() / 60.0;
        score += Math.min(MAX_ROUND_ROBIN_BONUS, hoursWaiting);
        if (hoursWaiting > 4) {
            reasons.add("Due for assignment (round robin)");
        }

        String reason = reasons.isEmpty() ? "Available representative" : String.join(", ", reasons);
        return new RepresentativeScore(rep, Math.round(score), reason);
    }

    static boolean inTerritory(SalesRepresentative rep, String location) {
        if (location == null || location.isBlank() || rep.getTerritory() == null) {
            return false;
        }
        String normalized = location.toLowerCase(Locale.ROOT);
        for (String area : rep.getTerritory().split(",")) {
            String trimmed = area.trim().toLowerCase(Locale.ROOT);
            if (!trimmed.isEmpty() && normalized.contains(trimmed)) {
                return true;
            }
        }
        return false;
    }

    static List<String> recommendedActions(AssignLeadPayload lead) {
        List<String> actions = new ArrayList<>();
        Urgency urgency = lead.getUrgency() == null ? Urgency.LOW : lead.getUrgency();

        if (urgency == Urgency.URGENT) {
            actions.add("Contact lead within 15 minutes");
            actions.add("Send immediate SMS acknowledgment");
        } else if (urgency == Urgency.HIGH) {
            actions.add("Contact lead within 1 hour");
            actions.add("Send email acknowledgment");
        } else {
            actions.add("Contact lead within 4 hours");
            actions.add("Send welcome email sequence");
        }

        if (lead.getLeadScore() != null && lead.getLeadScore() > 80) {
            actions.add("Prepare financing options");
            actions.add("Schedule test drive if applicable");
        }
        if (lead.getVehicleType() != null) {
            actions.add("Focus on " + lead.getVehicleType() + " inventory");
        }
        return actions;
    }
}
