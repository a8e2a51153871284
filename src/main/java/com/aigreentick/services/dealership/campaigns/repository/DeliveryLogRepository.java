package com.aigreentick.services.dealership.campaigns.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.aigreentick.services.dealership.campaigns.enums.DeliveryStatus;
import com.aigreentick.services.dealership.campaigns.model.DeliveryLog;

@Repository
public interface DeliveryLogRepository extends JpaRepository<DeliveryLog, Long> {

    boolean existsByProviderMessageIdAndStatus(String providerMessageId, DeliveryStatus status);

    /** The SENT row of a provider message, used to find its campaign. */
    Optional<DeliveryLog> findFirstByProviderMessageIdAndStatusOrderByIdAsc(String providerMessageId, DeliveryStatus status);

    boolean existsByDedupeKeyAndStatus(String dedupeKey, DeliveryStatus status);

    List<DeliveryLog> findByCampaignIdOrderByIdAsc(Long campaignId);

    long countByCampaignIdAndStatus(Long campaignId, DeliveryStatus status);
}
