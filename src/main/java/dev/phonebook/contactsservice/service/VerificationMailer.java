package dev.phonebook.contactsservice.service;

import dev.phonebook.contactsservice.config.AsyncConfig;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;
import org.springframework.web.util.HtmlUtils;

/**
 * Best-effort delivery of verification links. Sending happens on the mail executor;
 * callers never wait for SMTP and delivery failures end up in the log only.
 */
@Component
public class VerificationMailer {

    private static final Logger log = LoggerFactory.getLogger(VerificationMailer.class);

    static final String TEMPLATE = "templates/verification_email.html";
    static final String SUBJECT = "Confirm your email";

    private final JavaMailSender mailSender;
    private final String fromAddress;
    private final String fromName;
    private final String template;

    public VerificationMailer(JavaMailSender mailSender,
                              @Value("${app.mail.from}") String fromAddress,
                              @Value("${app.mail.from-name:Contacts}") String fromName) {
        this.mailSender = mailSender;
        this.fromAddress = fromAddress;
        this.fromName = fromName;
        this.template = loadTemplate();
    }

    @Async(AsyncConfig.MAIL_EXECUTOR)
    public void sendVerification(String toEmail, String username, String verifyLink) {
        try {
            MimeMessage message = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(message, false, StandardCharsets.UTF_8.name());
            helper.setFrom(fromAddress, fromName);
            helper.setTo(toEmail);
            helper.setSubject(SUBJECT);
            helper.setText(render(username, verifyLink), true);
            mailSender.send(message);
            log.info("Verification email sent to {}", toEmail);
        } catch (MessagingException | UnsupportedEncodingException | RuntimeException ex) {
            log.error("Failed to send verification email to {}: {}", toEmail, ex.getMessage());
        }
    }

    String render(String username, String verifyLink) {
        return template
            .replace("{{username}}", HtmlUtils.htmlEscape(username))
            .replace("{{link}}", HtmlUtils.htmlEscape(verifyLink));
    }

    private static String loadTemplate() {
        try (InputStream in = new ClassPathResource(TEMPLATE).getInputStream()) {
            return StreamUtils.copyToString(in, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Missing mail template " + TEMPLATE, ex);
        }
    }
}
