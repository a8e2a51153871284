package com.aigreentick.services.dealership.leads.repository;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.aigreentick.services.dealership.leads.model.Purchase;

@Repository
public interface PurchaseRepository extends JpaRepository<Purchase, Long> {

    List<Purchase> findByCustomerIdOrderByPurchasedAtAsc(Long customerId);

    /**
     * Dealership revenue in [from, to).
     */
    @Query("""
                SELECT COALESCE(SUM(p.amount), 0)
                FROM Purchase p
                WHERE p.purchasedAt >= :from
                  AND p.purchasedAt < :to
            """)
    BigDecimal sumRevenueBetween(@Param("from") LocalDateTime from, @Param("to") LocalDateTime to);
}
