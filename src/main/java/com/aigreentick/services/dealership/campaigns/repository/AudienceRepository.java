package com.aigreentick.services.dealership.campaigns.repository;

import java.util.List;

import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

import com.aigreentick.services.dealership.leads.model.Customer;

/**
 * Campaign recipient queries. Every list is ordered by customer id so that batch
 * slices taken from separate calls line up.
 */
public interface AudienceRepository extends Repository<Customer, Long> {

    @Query("""
                SELECT c FROM Customer c
                WHERE c.active = true
                  AND c.marketingOptIn = true
                  AND c.emailBounced = false
                  AND c.email IS NOT NULL AND c.email <> ''
                ORDER BY c.id ASC
            """)
    List<Customer> findEmailAudience();

    @Query("""
                SELECT c FROM Customer c
                WHERE c.active = true
                  AND c.marketingOptIn = true
                  AND c.emailBounced = false
                  AND c.email IS NOT NULL AND c.email <> ''
                  AND c.id IN (SELECT m.customerId FROM SegmentMember m WHERE m.segmentId = :segmentId)
                ORDER BY c.id ASC
            """)
    List<Customer> findEmailSegmentAudience(@Param("segmentId") Long segmentId);

    @Query("""
                SELECT c FROM Customer c
                WHERE c.active = true
                  AND c.smsOptIn = true
                  AND c.phone IS NOT NULL AND c.phone <> ''
                ORDER BY c.id ASC
            """)
    List<Customer> findSmsAudience();

    @Query("""
                SELECT c FROM Customer c
                WHERE c.active = true
                  AND c.smsOptIn = true
                  AND c.phone IS NOT NULL AND c.phone <> ''
                  AND c.id IN (SELECT m.customerId FROM SegmentMember m WHERE m.segmentId = :segmentId)
                ORDER BY c.id ASC
            """)
    List<Customer> findSmsSegmentAudience(@Param("segmentId") Long segmentId);
}
