package com.bbms.authbroker.modules.detection.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.OffsetDateTime;

/**
 * Message posted by the capture surface, e.g.
 * {@code {"type":"pageChange","pageName":"verifiedPage","success":true}}.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class CaptureEvent {

    public static final String VERIFIED_PAGE = "verifiedPage";

    @NotBlank(message = "type is required")
    private String type;

    private String pageName;

    private Boolean success;

    /** When the capture surface saw the page. Logged only; the broker stamps its own receipt time. */
    private OffsetDateTime occurredAt;

    public boolean isVerifiedSuccess() {
        return VERIFIED_PAGE.equals(pageName) && Boolean.TRUE.equals(success);
    }
}
