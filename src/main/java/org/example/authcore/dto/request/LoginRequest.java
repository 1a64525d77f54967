package org.example.authcore.dto.request;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class LoginRequest {

    @NotBlank(message = "Email must not be empty")
    @Email(message = "Email must be a valid address")
    private String email;

    @NotBlank(message = "Password must not be empty")
    @Size(min = 6, max = 20, message = "Password must be 6 to 20 characters")
    private String password;

    public LoginRequest() {
    }

    public LoginRequest(String email, String password) {
        this.email = email;
        this.password = password;
    }
}
