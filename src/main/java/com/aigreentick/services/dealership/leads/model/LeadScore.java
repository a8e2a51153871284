package com.aigreentick.services.dealership.leads.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import com.aigreentick.services.dealership.leads.enums.ConversionGrade;
import com.aigreentick.services.dealership.leads.enums.QualificationLevel;

/**
 * One scoring result. Rows are only ever inserted; a recalculation adds a new row
 * so the score history of a lead stays auditable.
 */
@Entity
@Immutable
@Table(
    name = "lead_scores",
    indexes = {
        @Index(name = "idx_lead_scores_customer", columnList = "customer_id, calculated_at"),
        @Index(name = "idx_lead_scores_inquiry", columnList = "inquiry_id, calculated_at")
    }
)
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LeadScore {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "customer_id")
    private Long customerId;

    @Column(name = "inquiry_id")
    private Long inquiryId;

    @Column(name = "total_score", nullable = false)
    private double totalScore;

    @Column(name = "max_possible_score", nullable = false)
    private double maxPossibleScore;

    @Column(name = "score_percentage", nullable = false)
    private double scorePercentage;

    @Enumerated(EnumType.STRING)
    @Column(name = "qualification_level", nullable = false, length = 20)
    private QualificationLevel qualificationLevel;

    @Enumerated(EnumType.STRING)
    @Column(name = "conversion_grade", length = 2)
    private ConversionGrade conversionGrade;

    @Column(name = "conversion_probability")
    private double conversionProbability;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "json")
    private Map<String, Double> factors;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "json")
    private List<String> recommendations;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "next_actions", columnDefinition = "json")
    private List<String> nextActions;

    @Column(name = "incremental_update", nullable = false)
    private boolean incrementalUpdate;

    @Column(name = "update_reason", length = 100)
    private String updateReason;

    @Column(name = "calculated_at", nullable = false)
    private LocalDateTime calculatedAt;
}
