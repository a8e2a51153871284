package com.aigreentick.services.dealership.campaigns.repository;

import java.time.LocalDateTime;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import com.aigreentick.services.dealership.campaigns.enums.CampaignStatus;
import com.aigreentick.services.dealership.campaigns.model.Campaign;
import com.aigreentick.services.dealership.common.exception.IllegalStateTransitionException;

@Repository
public interface CampaignRepository extends JpaRepository<Campaign, Long> {

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
                UPDATE Campaign c
                SET c.sent = c.sent + :count,
                    c.updatedAt = :now
                WHERE c.id = :id
            """)
    int incrementSent(@Param("id") Long id, @Param("count") int count, @Param("now") LocalDateTime now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
                UPDATE Campaign c
                SET c.delivered = c.delivered + 1,
                    c.updatedAt = :now
                WHERE c.id = :id
            """)
    int incrementDelivered(@Param("id") Long id, @Param("now") LocalDateTime now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
                UPDATE Campaign c
                SET c.bounced = c.bounced + 1,
                    c.updatedAt = :now
                WHERE c.id = :id
            """)
    int incrementBounced(@Param("id") Long id, @Param("now") LocalDateTime now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
                UPDATE Campaign c
                SET c.failed = c.failed + 1,
                    c.updatedAt = :now
                WHERE c.id = :id
            """)
    int incrementFailed(@Param("id") Long id, @Param("now") LocalDateTime now);

    /**
     * Status compare-and-set. {@code sentAt} is only written when not null.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
                UPDATE Campaign c
                SET c.status = :to,
                    c.sentAt = COALESCE(:sentAt, c.sentAt),
                    c.updatedAt = :now
                WHERE c.id = :id
                  AND c.status = :from
            """)
    int compareAndSetStatus(
            @Param("id") Long id,
            @Param("from") CampaignStatus from,
            @Param("to") CampaignStatus to,
            @Param("sentAt") LocalDateTime sentAt,
            @Param("now") LocalDateTime now);

    /**
     * Moves a campaign along its transition table. Rejects transitions the table does not
     * allow and transitions that lost a race with another writer.
     */
    default void transition(Campaign campaign, CampaignStatus to, LocalDateTime now) {
        CampaignStatus from = campaign.getStatus();
        if (!from.canTransitionTo(to)) {
            throw new IllegalStateTransitionException("Campaign", campaign.getId(), from, to);
        }
        LocalDateTime sentAt = to == CampaignStatus.SENT ? now : null;
        if (compareAndSetStatus(campaign.getId(), from, to, sentAt, now) != 1) {
            throw new IllegalStateTransitionException("Campaign", campaign.getId(), "status changed concurrently");
        }
    }
}
