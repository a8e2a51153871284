package com.aigreentick.services.dealership.leads.model;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Locale;

@Entity
@Table(name = "sales_representatives")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SalesRepresentative {

    public static final String ALL_VEHICLES = "ALL_VEHICLES";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(nullable = false, length = 255)
    private String email;

    @Column(length = 20)
    private String phone;

    @Column(nullable = false)
    @Builder.Default
    private boolean active = true;

    @Column(nullable = false)
    @Builder.Default
    private boolean available = true;

    // comma separated body types, or ALL_VEHICLES
    @Column(name = "vehicle_expertise", length = 255)
    private String vehicleExpertise;

    // comma separated PriceCategory names
    @Column(name = "price_categories", length = 100)
    private String priceCategories;

    // comma separated ISO codes
    @Column(length = 100)
    private String languages;

    @Column(length = 255)
    private String territory;

    // percentage, 0..100
    @Column(name = "conversion_rate", precision = 5, scale = 2)
    @Builder.Default
    private BigDecimal conversionRate = BigDecimal.ZERO;

    @Column(name = "current_active_leads", nullable = false)
    private int currentActiveLeads;

    @Column(name = "max_active_leads", nullable = false)
    @Builder.Default
    private int maxActiveLeads = 15;

    @Column(name = "can_handle_urgent", nullable = false)
    private boolean canHandleUrgent;

    @Column(name = "work_start_hour", nullable = false)
    @Builder.Default
    private int workStartHour = 8;

    @Column(name = "work_end_hour", nullable = false)
    @Builder.Default
    private int workEndHour = 18;

    // comma separated DayOfWeek names
    @Column(name = "work_days", length = 100)
    @Builder.Default
    private String workDays = "MONDAY,TUESDAY,WEDNESDAY,THURSDAY,FRIDAY,SATURDAY";

    @Column(name = "last_active_at")
    private LocalDateTime lastActiveAt;

    @Column(name = "last_assignment_at")
    private LocalDateTime lastAssignmentAt;

    public boolean hasExpertise(String vehicleType) {
        return listContains(vehicleExpertise, ALL_VEHICLES)
                || (vehicleType != null && listContains(vehicleExpertise, vehicleType));
    }

    public boolean handlesPriceCategory(String category) {
        return category != null && listContains(priceCategories, category);
    }

    public boolean speaks(String language) {
        return language != null && listContains(languages, language);
    }

    public boolean worksOn(String dayOfWeek) {
        return listContains(workDays, dayOfWeek);
    }

    private static boolean listContains(String csv, String value) {
        if (csv == null || csv.isBlank()) {
            return false;
        }
        String needle = value.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(csv.split(","))
                .map(s -> s.trim().toUpperCase(Locale.ROOT))
                .anyMatch(needle::equals);
    }
}
