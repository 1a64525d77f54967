package org.example.authcore.dto.request;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class ActivateRequest {

    @NotBlank(message = "Email must not be empty")
    @Email(message = "Email must be a valid address")
    private String email;

    @NotBlank(message = "Activation code must not be empty")
    @Size(min = 8, max = 8, message = "Activation code must be 8 characters")
    private String token;

    public ActivateRequest() {
    }

    public ActivateRequest(String email, String token) {
        this.email = email;
        this.token = token;
    }
}
