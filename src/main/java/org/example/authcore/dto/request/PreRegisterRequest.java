package org.example.authcore.dto.request;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class PreRegisterRequest {

    @NotBlank(message = "Email must not be empty")
    @Email(message = "Email must be a valid address")
    private String email;

    @NotBlank(message = "Password must not be empty")
    @Size(min = 6, max = 20, message = "Password must be 6 to 20 characters")
    private String password;

    public PreRegisterRequest() {
    }

    public PreRegisterRequest(String email, String password) {
        this.email = email;
        this.password = password;
    }
}
