package com.aigreentick.services.dealership.leads.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.aigreentick.services.dealership.leads.enums.VehicleStatus;
import com.aigreentick.services.dealership.leads.model.Vehicle;

@Repository
public interface VehicleRepository extends JpaRepository<Vehicle, Long> {

    /**
     * Average asking price of comparable stock, null when there is none.
     */
    @Query("""
                SELECT AVG(v.price)
                FROM Vehicle v
                WHERE v.make = :make
                  AND v.model = :model
                  AND v.year BETWEEN :minYear AND :maxYear
                  AND v.status = :status
                  AND v.price IS NOT NULL
            """)
    Double averagePriceOfSimilar(
            @Param("make") String make,
            @Param("model") String model,
            @Param("minYear") int minYear,
            @Param("maxYear") int maxYear,
            @Param("status") VehicleStatus status);
}
