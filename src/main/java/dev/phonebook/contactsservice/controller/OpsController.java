package dev.phonebook.contactsservice.controller;

import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import java.util.Map;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class OpsController {

    private final ObjectProvider<PrometheusMeterRegistry> prometheusMeterRegistry;

    public OpsController(ObjectProvider<PrometheusMeterRegistry> prometheusMeterRegistry) {
        this.prometheusMeterRegistry = prometheusMeterRegistry;
    }

    @GetMapping("/")
    public Map<String, String> root() {
        return Map.of("message", "Contacts API");
    }

    @GetMapping({"/contacts", "/contacts/"})
    public Map<String, String> contactsRoot() {
        return Map.of("message", "Contacts API: contacts router");
    }

    @GetMapping("/healthchecker")
    public Map<String, String> healthchecker() {
        return Map.of("message", "Welcome to Contacts API!");
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok", "service", "contacts-service");
    }

    @GetMapping(value = "/metrics", produces = MediaType.TEXT_PLAIN_VALUE)
    public String metrics() {
        PrometheusMeterRegistry registry = prometheusMeterRegistry.getIfAvailable();
        return registry != null ? registry.scrape() : "";
    }
}
