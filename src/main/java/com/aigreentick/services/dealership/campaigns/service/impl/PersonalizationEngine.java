package com.aigreentick.services.dealership.campaigns.service.impl;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Year;
import java.util.HashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.aigreentick.services.dealership.config.DealershipProperties;
import com.aigreentick.services.dealership.leads.model.Customer;

import lombok.RequiredArgsConstructor;

/**
 * Replaces {@code {{token}}} placeholders with recipient and dealership values.
 * Tokens without a value are left in the text as written.
 */
@Component
@RequiredArgsConstructor
public class PersonalizationEngine {

    private static final Pattern TOKEN = Pattern.compile("\\{\\{\\s*([A-Za-z][A-Za-z0-9_]*)\\s*}}");

    private final DealershipProperties dealership;
    private final Clock clock;

    /**
     * Recipient fields of a customer, in the shape the send jobs carry them.
     */
    public Map<String, String> recipientData(Customer customer) {
        Map<String, String> data = new HashMap<>();
        if (customer == null) {
            return data;
        }
        putIfPresent(data, "firstName", customer.getFirstName());
        putIfPresent(data, "lastName", customer.getLastName());
        putIfPresent(data, "email", customer.getEmail());
        putIfPresent(data, "phone", customer.getPhone());
        return data;
    }

    /**
     * @param recipientData recipient fields and caller-supplied values; these override the
     *                      derived tokens of the same name
     */
    public String personalize(String content, Map<String, String> recipientData) {
        if (content == null || content.indexOf("{{") < 0) {
            return content;
        }
        Map<String, String> tokens = tokens(recipientData == null ? Map.of() : recipientData);

        Matcher matcher = TOKEN.matcher(content);
        StringBuilder out = new StringBuilder(content.length());
        while (matcher.find()) {
            String value = tokens.get(matcher.group(1));
            matcher.appendReplacement(out, Matcher.quoteReplacement(value != null ? value : matcher.group()));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    Map<String, String> tokens(Map<String, String> recipientData) {
        String firstName = recipientData.getOrDefault("firstName", "");
        String lastName = recipientData.getOrDefault("lastName", "");
        String email = recipientData.getOrDefault("email", "");

        Map<String, String> tokens = new HashMap<>();
        tokens.put("firstName", firstName);
        tokens.put("lastName", lastName);
        tokens.put("fullName", (firstName + " " + lastName).trim());
        tokens.put("customerName", firstName.isBlank() ? "Customer" : firstName);
        tokens.put("email", email);
        tokens.put("phone", recipientData.getOrDefault("phone", ""));
        tokens.put("unsubscribeUrl", dealership.getSiteUrl() + "/unsubscribe?email="
                + URLEncoder.encode(email, StandardCharsets.UTF_8));
        tokens.put("siteUrl", dealership.getSiteUrl());
        tokens.put("companyName", dealership.getCompanyName());
        tokens.put("dealershipName", dealership.getName());
        tokens.put("dealershipPhone", dealership.getPhone());
        tokens.put("currentYear", String.valueOf(Year.now(clock).getValue()));
        tokens.put("stopText", dealership.getStopText());

        recipientData.forEach((key, value) -> {
            if (value != null) {
                tokens.put(key, value);
            }
        });
        return tokens;
    }

    private static void putIfPresent(Map<String, String> data, String key, String value) {
        if (value != null) {
            data.put(key, value);
        }
    }
}
