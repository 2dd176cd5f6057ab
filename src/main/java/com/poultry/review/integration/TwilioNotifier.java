package com.poultry.review.integration;

import com.poultry.review.config.TwilioNotificationConfig;
import com.twilio.Twilio;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Sends workflow events as SMS (or WhatsApp) messages through Twilio.
 * Applicants are reached on the phone number carried in the payload; named
 * groups such as "supervisors" are looked up in twilio.recipients.
 */
@Component
@ConditionalOnProperty(name = "twilio.enabled", havingValue = "true")
public class TwilioNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(TwilioNotifier.class);

    private final TwilioNotificationConfig config;

    public TwilioNotifier(TwilioNotificationConfig config) {
        this.config = config;
    }

    @PostConstruct
    public void init() {
        Twilio.init(config.getAccountSid(), config.getAuthToken());
        log.info("Twilio notifier initialized. Channel: {}", config.getChannel());
    }

    @Override
    public void notify(String recipient, NotificationEvent event, Map<String, Object> payload) {
        String to = resolveRecipient(recipient, payload);
        if (to == null) {
            log.warn("No phone number for recipient={}, event={}; message not sent", recipient, event);
            return;
        }

        Message message = Message.creator(
                new PhoneNumber(resolveNumber(to)),
                new PhoneNumber(resolveNumber(config.getFromNumber())),
                buildMessageBody(event, payload)
        ).create();

        log.info("Twilio notification sent: event={}, recipient={}, sid={}", event, recipient, message.getSid());
    }

    @Override
    public String channel() {
        return config.getChannel();
    }

    String buildMessageBody(NotificationEvent event, Map<String, Object> payload) {
        String headline = switch (event) {
            case APPLICATION_SUBMITTED -> "Your application has been received and is under review";
            case ELIGIBILITY_FAILED -> "Your application did not meet the eligibility requirements";
            case APPLICATION_ADVANCED -> "Your application has moved to the next review level";
            case APPLICATION_APPROVED -> "Your application has been approved";
            case APPLICATION_REJECTED -> "Your application has been rejected";
            case CHANGES_REQUESTED -> "Changes have been requested on your application";
            case APPLICATION_RESUBMITTED -> "Your changes have been received";
            case APPLICATION_WITHDRAWN -> "Your application has been withdrawn";
            case CHANGES_DEADLINE_EXPIRED -> "The deadline for requested changes has passed";
            case QUEUE_ENTRY_ESCALATED -> "A review has passed its SLA deadline";
        };

        StringBuilder body = new StringBuilder("[POULTRY PROGRAM] ").append(headline)
                .append("\nApplication: ").append(payload.get("applicationId"));
        if (payload.get("level") != null) {
            body.append("\nLevel: ").append(payload.get("level"));
        }
        if (payload.get("identifier") != null) {
            body.append("\nIdentifier: ").append(payload.get("identifier"));
        }
        if (payload.get("notes") != null) {
            body.append("\nNotes: ").append(payload.get("notes"));
        }
        return body.toString();
    }

    private String resolveRecipient(String recipient, Map<String, Object> payload) {
        Object phone = payload.get("phone");
        if (phone != null && !phone.toString().isBlank()) {
            return phone.toString();
        }
        return config.getRecipients().get(recipient);
    }

    private String resolveNumber(String number) {
        if ("whatsapp".equalsIgnoreCase(config.getChannel())) {
            return "whatsapp:" + number;
        }
        return number;
    }
}
