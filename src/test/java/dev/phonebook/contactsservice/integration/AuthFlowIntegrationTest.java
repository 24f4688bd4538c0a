package dev.phonebook.contactsservice.integration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.phonebook.contactsservice.domain.UserEntity;
import dev.phonebook.contactsservice.domain.UserRole;
import dev.phonebook.contactsservice.repository.ContactRepository;
import dev.phonebook.contactsservice.repository.UserRepository;
import dev.phonebook.contactsservice.security.JwtService;
import jakarta.mail.Session;
import jakarta.mail.internet.MimeMessage;
import java.util.Properties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Tag("integration")
class AuthFlowIntegrationTest {

    @Autowired private MockMvc mockMvc;
    @Autowired private ObjectMapper objectMapper;
    @Autowired private UserRepository userRepository;
    @Autowired private ContactRepository contactRepository;
    @Autowired private JwtService jwtService;

    @MockBean private JavaMailSender mailSender;

    @BeforeEach
    void cleanUp() {
        when(mailSender.createMimeMessage()).thenReturn(new MimeMessage(Session.getInstance(new Properties())));
        contactRepository.deleteAll();
        userRepository.deleteAll();
    }

    private void signup(String email) throws Exception {
        mockMvc.perform(post("/auth/signup")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"username\":\"alice\",\"email\":\"" + email + "\",\"password\":\"password123\"}"))
            .andExpect(status().isCreated());
    }

    private JsonNode login(String email) throws Exception {
        String body = mockMvc.perform(post("/auth/login")
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .param("username", email)
                .param("password", "password123"))
            .andExpect(status().isOk())
            .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(body);
    }

    @Test
    void signup_confirm_login_refresh_fullFlow() throws Exception {
        signup("alice@example.com");

        mockMvc.perform(post("/auth/login")
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .param("username", "alice@example.com")
                .param("password", "password123"))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.detail").value("Email not confirmed"));

        String emailToken = jwtService.issueEmailToken("alice@example.com");
        mockMvc.perform(get("/email/confirmed_email/" + emailToken))
            .andExpect(jsonPath("$.message").value("Email confirmed"));
        mockMvc.perform(get("/email/confirmed_email/" + emailToken))
            .andExpect(jsonPath("$.message").value("Your email is already confirmed"));

        JsonNode tokens = login("alice@example.com");
        String access = tokens.get("access_token").asText();
        String refresh = tokens.get("refresh_token").asText();

        mockMvc.perform(get("/user/me").header("Authorization", "Bearer " + access))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.email").value("alice@example.com"));

        mockMvc.perform(get("/user/me").header("Authorization", "Bearer " + refresh))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.detail").value("Could not validate credentials"));

        mockMvc.perform(get("/auth/refresh_token").header("Authorization", "Bearer " + refresh))
            .andExpect(status().isOk());

        mockMvc.perform(get("/auth/refresh_token").header("Authorization", "Bearer " + refresh))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.detail").value("Invalid refresh token"));
        assertNull(userRepository.findByEmail("alice@example.com").orElseThrow().getRefreshToken());
    }

    @Test
    void protectedRoute_withoutToken_is401() throws Exception {
        mockMvc.perform(get("/contacts/contacts/by_birthday"))
            .andExpect(status().isUnauthorized())
            .andExpect(header().string("WWW-Authenticate", "Bearer"));
    }

    @Test
    void contacts_areOwnerScopedAndListAllIsRoleGated() throws Exception {
        signup("alice@example.com");
        UserEntity alice = userRepository.findByEmail("alice@example.com").orElseThrow();
        alice.setConfirmed(true);
        userRepository.save(alice);
        String access = login("alice@example.com").get("access_token").asText();

        mockMvc.perform(post("/contacts/contacts")
                .header("Authorization", "Bearer " + access)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"fullname\":\"Bob Smith\",\"email\":\"bob@example.com\","
                    + "\"phone_number\":\"+380501112233\",\"birthday\":\"1990-05-17\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.birthday").value("1990-05-17"));

        mockMvc.perform(get("/contacts/contacts/by_email/bob@example.com").header("Authorization", "Bearer " + access))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.fullname").value("Bob Smith"));

        mockMvc.perform(get("/contacts/contacts/all").header("Authorization", "Bearer " + access))
            .andExpect(status().isForbidden());

        alice.setRole(UserRole.admin);
        userRepository.save(alice);
        mockMvc.perform(get("/contacts/contacts/all").header("Authorization", "Bearer " + access))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(1));
    }

    @Test
    void health_isPublic() throws Exception {
        mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ok"));
        mockMvc.perform(get("/contacts/"))
            .andExpect(status().isOk());
    }
}
