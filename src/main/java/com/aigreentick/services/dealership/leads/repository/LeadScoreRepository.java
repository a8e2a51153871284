package com.aigreentick.services.dealership.leads.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.aigreentick.services.dealership.leads.model.LeadScore;

@Repository
public interface LeadScoreRepository extends JpaRepository<LeadScore, Long> {

    Optional<LeadScore> findFirstByCustomerIdOrderByCalculatedAtDescIdDesc(Long customerId);

    Optional<LeadScore> findFirstByInquiryIdOrderByCalculatedAtDescIdDesc(Long inquiryId);

    List<LeadScore> findByCustomerIdOrderByCalculatedAtAsc(Long customerId);
}
