package com.aigreentick.services.dealership.leads.service.impl;

import java.util.Optional;

import org.springframework.stereotype.Component;

import com.aigreentick.services.dealership.leads.model.Customer;
import com.aigreentick.services.dealership.leads.model.Inquiry;
import com.aigreentick.services.dealership.leads.repository.CustomerRepository;
import com.aigreentick.services.dealership.leads.repository.InquiryRepository;

import lombok.RequiredArgsConstructor;

/**
 * Finds who a lead is: the customer record when there is one, the inquiry's contact
 * fields otherwise.
 */
@Component
@RequiredArgsConstructor
public class LeadContactResolver {

    static final String UNKNOWN_NAME = "Customer";

    private final CustomerRepository customerRepository;
    private final InquiryRepository inquiryRepository;

    public record LeadContact(String name, String email, String phone, Long vehicleId) {
    }

    public LeadContact resolve(Long customerId, Long inquiryId) {
        Optional<Inquiry> inquiry = inquiryId == null ? Optional.empty() : inquiryRepository.findById(inquiryId);
        Long vehicleId = inquiry.map(Inquiry::getVehicleId).orElse(null);

        if (customerId != null) {
            Optional<Customer> customer = customerRepository.findById(customerId);
            if (customer.isPresent()) {
                Customer c = customer.get();
                String name = c.getFirstName() != null ? c.getFullName() : UNKNOWN_NAME;
                return new LeadContact(name, c.getEmail(), c.getPhone(), vehicleId);
            }
        }

        return inquiry
                .map(i -> new LeadContact(
                        i.getName() != null && !i.getName().isBlank() ? i.getName().trim() : UNKNOWN_NAME,
                        i.getEmail(), i.getPhone(), vehicleId))
                .orElse(new LeadContact(UNKNOWN_NAME, null, null, vehicleId));
    }
}
