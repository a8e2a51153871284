package com.aigreentick.services.dealership.campaigns.service.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.aigreentick.services.dealership.campaigns.enums.Channel;
import com.aigreentick.services.dealership.campaigns.model.Campaign;
import com.aigreentick.services.dealership.campaigns.repository.AudienceRepository;
import com.aigreentick.services.dealership.leads.model.Customer;

@ExtendWith(MockitoExtension.class)
class RecipientResolverTest {

    @Mock
    private AudienceRepository audienceRepository;

    @InjectMocks
    private RecipientResolver recipientResolver;

    @Test
    @DisplayName("Segment membership wins over a custom audience rule")
    void segmentFirst() {
        Customer member = Customer.builder().id(1L).email("a@example.com").build();
        when(audienceRepository.findEmailSegmentAudience(5L)).thenReturn(List.of(member));

        List<Customer> recipients = recipientResolver.resolve(Campaign.builder()
                .id(1L).channel(Channel.EMAIL).segmentId(5L).customAudience("city = 'Prishtina'").build());

        assertThat(recipients).containsExactly(member);
    }

    @Test
    @DisplayName("A custom audience resolves to nobody instead of every customer")
    void customAudienceIsEmpty() {
        List<Customer> recipients = recipientResolver.resolve(Campaign.builder()
                .id(2L).channel(Channel.SMS).customAudience("lastPurchase > 2020").build());

        assertThat(recipients).isEmpty();
        verifyNoInteractions(audienceRepository);
    }

    @Test
    @DisplayName("Without segment or rule all consented customers of the channel are used")
    void fallbackToAllConsented() {
        when(audienceRepository.findSmsAudience()).thenReturn(List.of());

        recipientResolver.resolve(Campaign.builder().id(3L).channel(Channel.SMS).build());

        verify(audienceRepository).findSmsAudience();
    }
}
