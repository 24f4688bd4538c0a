package dev.phonebook.contactsservice.controller;

import dev.phonebook.contactsservice.dto.EmailRequest;
import dev.phonebook.contactsservice.service.AuthService;
import jakarta.validation.Valid;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/email")
public class EmailController {

    private final AuthService authService;

    public EmailController(AuthService authService) {
        this.authService = authService;
    }

    @GetMapping("/confirmed_email/{token}")
    public Map<String, String> confirmedEmail(@PathVariable("token") String token) {
        return Map.of("message", authService.confirmEmail(token));
    }

    @PostMapping("/request_email")
    public Map<String, String> requestEmail(@Valid @RequestBody EmailRequest request) {
        return Map.of("message", authService.requestEmail(request.email(), AuthController.requestBaseUrl()));
    }
}
