package com.poultry.review.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "twilio")
public class TwilioNotificationConfig {

    private String accountSid;
    private String authToken;
    private String fromNumber;
    private boolean enabled = false;
    private String channel = "sms";  // "sms" or "whatsapp"

    // Phone numbers of recipients that are not applicants, e.g. "supervisors" for escalations
    private Map<String, String> recipients = new LinkedHashMap<>();
}
