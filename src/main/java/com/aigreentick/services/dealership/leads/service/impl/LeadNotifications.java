package com.aigreentick.services.dealership.leads.service.impl;

import java.time.format.DateTimeFormatter;
import java.util.List;

import com.aigreentick.services.dealership.config.DealershipProperties;
import com.aigreentick.services.dealership.leads.enums.FollowUpType;
import com.aigreentick.services.dealership.leads.model.LeadAssignment;
import com.aigreentick.services.dealership.leads.model.SalesRepresentative;
import com.aigreentick.services.dealership.leads.model.Vehicle;

/**
 * Subjects and bodies of the internal lead emails.
 */
final class LeadNotifications {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private LeadNotifications() {
    }

    static String assignmentSubject(double confidence) {
        return "New Lead Assignment - " + (confidence > 70 ? "High Priority" : "Standard Priority");
    }

    static String assignmentContent(String leadName, double confidence, String reason,
            List<String> recommendedActions, DealershipProperties dealership) {
        StringBuilder body = new StringBuilder()
                .append("You have been assigned a new lead!\n\n")
                .append("Customer: ").append(leadName).append('\n')
                .append("Priority: ").append(confidence > 70 ? "High" : "Medium").append('\n')
                .append("Confidence Score: ").append(Math.round(confidence)).append("%\n")
                .append("Assignment Reason: ").append(reason).append("\n\n")
                .append("Recommended Actions:\n");
        recommendedActions.forEach(action -> body.append("- ").append(action).append('\n'));
        return body.append("\nPlease contact this lead as soon as possible.\n\n")
                .append(dealership.getName()).append(" Marketing System\n")
                .toString();
    }

    static String acknowledgmentSubject(DealershipProperties dealership) {
        return "Thank you for your interest - " + dealership.getName();
    }

    static String acknowledgmentContent(String leadName, SalesRepresentative rep, DealershipProperties dealership) {
        String repName = rep != null ? rep.getName() : dealership.getName() + " Team";
        String repPhone = rep != null && rep.getPhone() != null ? rep.getPhone() : dealership.getPhone();

        return "Dear " + leadName + ",\n\n"
                + "Thank you for your interest in " + dealership.getName() + "!\n\n"
                + "Your message has been received and a sales representative will contact you shortly.\n\n"
                + "Your representative: " + repName + "\n"
                + "Phone: " + repPhone + "\n\n"
                + "Direct contact:\n"
                + "Phone: " + dealership.getPhone() + "\n"
                + "Email: " + dealership.getEmail() + "\n\n"
                + "Thank you,\n"
                + dealership.getName() + " Team\n";
    }

    static String reminderSubject(FollowUpType type) {
        return type == FollowUpType.INITIAL_CONTACT
                ? "Reminder: New Lead Assignment"
                : "Follow-up Reminder: Customer Contact";
    }

    static String reminderContent(FollowUpType type, LeadAssignment assignment, String leadName, Vehicle vehicle) {
        String vehicleInfo = vehicle != null
                ? vehicle.getMake() + " " + vehicle.getModel() + " " + vehicle.getYear()
                : "General inquiry";

        StringBuilder body = new StringBuilder()
                .append(type == FollowUpType.INITIAL_CONTACT ? "New Lead Assignment Reminder" : "Follow-up Reminder")
                .append("\n\n")
                .append("Customer: ").append(leadName).append('\n')
                .append("Vehicle Interest: ").append(vehicleInfo).append('\n')
                .append("Assignment Date: ").append(assignment.getAssignedAt().format(TIMESTAMP)).append('\n')
                .append("Priority: ").append(assignment.getPriority()).append('\n');
        if (assignment.getDueAt() != null) {
            body.append("Due: ").append(assignment.getDueAt().format(TIMESTAMP)).append('\n');
        }

        body.append('\n');
        if (type == FollowUpType.INITIAL_CONTACT) {
            body.append("This lead has not been contacted yet. Please reach out and update the assignment status.\n");
        } else {
            body.append("Please follow up with this customer and record the outcome.\n");
        }
        return body.toString();
    }
}
