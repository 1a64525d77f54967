package org.example.authcore.controller;

import lombok.RequiredArgsConstructor;
import org.example.authcore.dto.response.UserProfileResponse;
import org.example.authcore.exception.InvalidTokenException;
import org.example.authcore.model.Account;
import org.example.authcore.service.SessionService;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/restricted/user")
@RequiredArgsConstructor
@CrossOrigin(origins = "${app.cors.allowed-origins:http://localhost:5173}", allowCredentials = "true")
public class UserController {
    private final SessionService sessionService;

    @GetMapping("/me")
    public ResponseEntity<UserProfileResponse> getCurrentUser() {
        Account account = sessionService.get(getCurrentAccountId());
        return ResponseEntity.ok(new UserProfileResponse(
                account.getId(),
                account.getEmail(),
                account.getUpdatedAt(),
                account.getCreatedAt()
        ));
    }

    private long getCurrentAccountId() {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth == null || !(auth.getPrincipal() instanceof Long accountId)) {
            throw new InvalidTokenException("Not authenticated");
        }
        return accountId;
    }
}
