package com.aigreentick.services.dealership.leads.repository;

import java.time.LocalDateTime;
import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import com.aigreentick.services.dealership.leads.model.SalesRepresentative;

@Repository
public interface SalesRepresentativeRepository extends JpaRepository<SalesRepresentative, Long> {

    List<SalesRepresentative> findByActiveTrueAndAvailableTrue();

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
                UPDATE SalesRepresentative r
                SET r.currentActiveLeads = r.currentActiveLeads + 1,
                    r.lastAssignmentAt = :now
                WHERE r.id = :id
            """)
    int incrementWorkload(@Param("id") Long id, @Param("now") LocalDateTime now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
                UPDATE SalesRepresentative r
                SET r.currentActiveLeads = r.currentActiveLeads - 1
                WHERE r.id = :id
                  AND r.currentActiveLeads > 0
            """)
    int decrementWorkload(@Param("id") Long id);
}
