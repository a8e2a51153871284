package com.aigreentick.services.dealership.leads.service.impl;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.aigreentick.services.dealership.leads.enums.InquiryType;
import com.aigreentick.services.dealership.leads.enums.QualificationLevel;

/**
 * Sales guidance attached to every score row.
 */
final class LeadRecommendations {

    private LeadRecommendations() {
    }

    static List<String> nextActions(QualificationLevel level) {
        return switch (level) {
            case QUALIFIED -> List.of(
                    "Immediate phone call within 1 hour",
                    "Schedule in-person meeting",
                    "Prepare financing options");
            case HOT -> List.of(
                    "Phone call within 4 hours",
                    "Send detailed vehicle information",
                    "Offer test drive appointment");
            case WARM -> List.of(
                    "Follow up within 24 hours",
                    "Send email with similar vehicles",
                    "Add to nurturing campaign");
            case COLD -> List.of(
                    "Add to general email campaign",
                    "Send monthly newsletter",
                    "Retarget with social media ads");
        };
    }

    /**
     * @param raw unweighted customer factor scores
     */
    static List<String> forCustomer(Map<String, Double> raw, int recentInquiries) {
        List<String> recommendations = new ArrayList<>();

        if (raw.get("engagement") < 20) {
            recommendations.add("Increase engagement through targeted email campaigns");
            recommendations.add("Send personalized vehicle recommendations");
        }
        if (raw.get("purchaseHistory") >= 50) {
            recommendations.add("Repeat buyer - offer loyalty incentives and trade-in valuation");
        }
        if (raw.get("lifecycle") >= 80) {
            recommendations.add("New customer - send welcome offer");
        }
        if (recentInquiries > 2) {
            recommendations.add("Multiple inquiries indicate serious interest - expedite follow-up");
        }
        return recommendations;
    }

    /**
     * @param raw unweighted inquiry factor scores
     */
    static List<String> forInquiry(InquiryType type, Map<String, Double> raw, double percentage) {
        List<String> recommendations = new ArrayList<>();

        if (raw.get("responseTime") < 70) {
            recommendations.add("Follow up immediately - response time is affecting lead quality");
        }
        if (raw.get("contactCompleteness") < 60) {
            recommendations.add("Request additional contact information");
        }
        if (raw.get("inquiryType") >= 70) {
            recommendations.add("High-intent inquiry - prioritize personal contact");
        }
        if (raw.get("vehicleAppeal") < 50) {
            recommendations.add("Highlight vehicle features and value proposition");
        }
        if (type == InquiryType.FINANCING) {
            recommendations.add("Prepare financing options before the first call");
        }
        if (type == InquiryType.TEST_DRIVE) {
            recommendations.add("High-priority lead - schedule test drive within 24 hours");
        }
        if (percentage > 70) {
            recommendations.add("High-quality lead - assign to senior sales representative");
        }
        return recommendations;
    }
}
