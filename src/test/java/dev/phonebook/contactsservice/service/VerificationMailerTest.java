package dev.phonebook.contactsservice.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import jakarta.mail.Session;
import jakarta.mail.internet.MimeMessage;
import java.util.Properties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mail.MailSendException;
import org.springframework.mail.javamail.JavaMailSender;

@ExtendWith(MockitoExtension.class)
class VerificationMailerTest {

    @Mock private JavaMailSender mailSender;

    private VerificationMailer mailer;

    @BeforeEach
    void setUp() {
        mailer = new VerificationMailer(mailSender, "noreply@example.com", "Contacts");
    }

    @Test
    void render_escapesUsernameAndInsertsLink() {
        String html = mailer.render("<b>alice</b>", "http://localhost/email/confirmed_email/abc");

        assertTrue(html.contains("&lt;b&gt;alice&lt;/b&gt;"));
        assertTrue(html.contains("http://localhost/email/confirmed_email/abc"));
        assertFalse(html.contains("{{"));
    }

    @Test
    void send_buildsHtmlMessage() throws Exception {
        when(mailSender.createMimeMessage()).thenReturn(new MimeMessage(Session.getInstance(new Properties())));

        mailer.sendVerification("alice@example.com", "alice", "http://localhost/email/confirmed_email/abc");

        verify(mailSender).send(argThat((MimeMessage message) -> {
            try {
                return VerificationMailer.SUBJECT.equals(message.getSubject())
                    && "alice@example.com".equals(message.getAllRecipients()[0].toString());
            } catch (Exception ex) {
                return false;
            }
        }));
    }

    @Test
    void send_failureIsLoggedNotThrown() {
        when(mailSender.createMimeMessage()).thenReturn(new MimeMessage(Session.getInstance(new Properties())));
        doThrow(new MailSendException("smtp down")).when(mailSender).send(any(MimeMessage.class));

        assertDoesNotThrow(() -> mailer.sendVerification("alice@example.com", "alice", "http://x/y"));
    }

    @Test
    void send_unexpectedRuntimeFailureIsLoggedNotThrown() {
        when(mailSender.createMimeMessage()).thenThrow(new IllegalStateException("session unavailable"));

        assertDoesNotThrow(() -> mailer.sendVerification("alice@example.com", "alice", "http://x/y"));
        verify(mailSender, never()).send(any(MimeMessage.class));
    }
}
