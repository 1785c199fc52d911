package com.bbms.authbroker.modules.lifecycle.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.HashMap;
import java.util.Map;

/**
 * Webhook body posted by the provider, e.g.
 * {@code {"event_type":"verification.completed","data":{"transaction_id":"...","user_id":"..."}}}.
 */
@Getter
@Setter
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProviderWebhookEvent {

    public static final String ENROLLMENT_COMPLETED = "enrollment.completed";
    public static final String ENROLLMENT_FAILED = "enrollment.failed";
    public static final String VERIFICATION_COMPLETED = "verification.completed";
    public static final String VERIFICATION_FAILED = "verification.failed";
    public static final String USER_UPDATED = "user.updated";
    public static final String SECURITY_ALERT = "security.alert";

    @JsonProperty("event_type")
    private String eventType;

    private Map<String, Object> data = new HashMap<>();

    /** Text value of a data field; null when absent or blank. */
    public String text(String field) {
        Object value = data != null ? data.get(field) : null;
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }

    /** The first of the given data fields that carries a value. */
    public String firstText(String... fields) {
        for (String field : fields) {
            String value = text(field);
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
