package dev.phonebook.contactsservice.controller;

import dev.phonebook.contactsservice.dto.SignupRequest;
import dev.phonebook.contactsservice.dto.TokenResponse;
import dev.phonebook.contactsservice.dto.UserResponse;
import dev.phonebook.contactsservice.security.AuthenticatedUser;
import dev.phonebook.contactsservice.service.AuthService;
import jakarta.validation.Valid;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

@RestController
@RequestMapping("/auth")
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @PostMapping("/signup")
    public ResponseEntity<UserResponse> signup(@Valid @RequestBody SignupRequest request) {
        UserResponse user = UserResponse.from(authService.signup(request, requestBaseUrl()));
        return ResponseEntity.status(HttpStatus.CREATED).body(user);
    }

    @PostMapping(value = "/login", consumes = {MediaType.APPLICATION_FORM_URLENCODED_VALUE, MediaType.MULTIPART_FORM_DATA_VALUE})
    public TokenResponse login(@RequestParam("username") String username,
                               @RequestParam("password") String password) {
        return authService.login(username, password);
    }

    @GetMapping("/refresh_token")
    public TokenResponse refreshToken(@RequestHeader(value = "Authorization", required = false) String authorization) {
        return authService.refresh(authorization);
    }

    @GetMapping("/secret")
    public Map<String, String> secret(@AuthenticationPrincipal AuthenticatedUser user) {
        return Map.of("message", "secret router", "owner", user.email());
    }

    static String requestBaseUrl() {
        return ServletUriComponentsBuilder.fromCurrentContextPath().build().toUriString();
    }
}
