package com.aigreentick.services.dealership.leads.model;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

import com.aigreentick.services.dealership.leads.enums.FuelType;
import com.aigreentick.services.dealership.leads.enums.VehicleStatus;

@Entity
@Table(
    name = "vehicles",
    indexes = {
        @Index(name = "idx_vehicles_make_model", columnList = "make, model, year")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Vehicle {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 60)
    private String make;

    @Column(nullable = false, length = 60)
    private String model;

    @Column(nullable = false)
    private int year;

    @Column(precision = 12, scale = 2)
    private BigDecimal price;

    private Integer mileage;

    @Enumerated(EnumType.STRING)
    @Column(name = "fuel_type", length = 20)
    private FuelType fuelType;

    @Column(name = "body_type", length = 30)
    private String bodyType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private VehicleStatus status = VehicleStatus.AVAILABLE;

    @Column(name = "view_count", nullable = false)
    private int viewCount;

    @Column(name = "inquiry_count", nullable = false)
    private int inquiryCount;
}
