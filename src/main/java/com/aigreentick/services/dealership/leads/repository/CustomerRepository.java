package com.aigreentick.services.dealership.leads.repository;

import java.time.LocalDateTime;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import com.aigreentick.services.dealership.leads.model.Customer;

@Repository
public interface CustomerRepository extends JpaRepository<Customer, Long> {

    Optional<Customer> findFirstByEmailIgnoreCase(String email);

    Optional<Customer> findFirstByPhone(String phone);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
                UPDATE Customer c
                SET c.emailBounced = true,
                    c.updatedAt = :now
                WHERE LOWER(c.email) = LOWER(:email)
            """)
    int markEmailBounced(@Param("email") String email, @Param("now") LocalDateTime now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
                UPDATE Customer c
                SET c.smsOptIn = :optIn,
                    c.updatedAt = :now
                WHERE c.phone = :phone
            """)
    int updateSmsOptIn(@Param("phone") String phone, @Param("optIn") boolean optIn, @Param("now") LocalDateTime now);
}
