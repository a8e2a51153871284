package com.aigreentick.services.dealership.leads.repository;

import java.util.List;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.aigreentick.services.dealership.leads.model.CustomerTouchpoint;

@Repository
public interface CustomerTouchpointRepository extends JpaRepository<CustomerTouchpoint, Long> {

    List<CustomerTouchpoint> findByCustomerIdOrderByOccurredAtDesc(Long customerId, Pageable pageable);
}
