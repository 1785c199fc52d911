package com.bbms.authbroker.modules.lifecycle.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class LoginInitiateRequest {

    @NotBlank(message = "accountNumber is required")
    private String accountNumber;
}
