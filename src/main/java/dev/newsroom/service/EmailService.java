package dev.newsroom.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.MessageSource;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.Locale;

/**
 * Plain-text account emails. Subjects and bodies come from {@code messages.properties}.
 * SMTP is blocking, so sends run on the bounded elastic scheduler.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class EmailService {

    private final JavaMailSender mailSender;
    private final MessageSource messageSource;

    @Value("${app.email.from:noreply@localhost}")
    private String fromEmail;

    @Value("${app.site-url:http://localhost:3000}")
    private String siteUrl;

    @Value("${app.email.timeout:PT10S}")
    private Duration timeout = Duration.ofSeconds(10);

    public Mono<Void> sendTextEmail(String to, String subject, String text) {
        return Mono.<Void>fromRunnable(() -> {
                    SimpleMailMessage message = new SimpleMailMessage();
                    message.setFrom(fromEmail);
                    message.setTo(to);
                    message.setSubject(subject);
                    message.setText(text);
                    mailSender.send(message);
                    log.debug("Email '{}' sent to {}", subject, to);
                })
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(timeout);
    }

    public Mono<Void> sendPasswordResetEmail(String to, String name, String plainToken) {
        String link = siteUrl + "/reset-password?token=" + plainToken;
        return sendTextEmail(to,
                msg("email.password_reset.subject"),
                msg("email.password_reset.body", displayName(name), link));
    }

    public Mono<Void> sendPasswordChangedNotification(String to, String name) {
        return sendTextEmail(to,
                msg("email.password_changed.subject"),
                msg("email.password_changed.body", displayName(name)));
    }

    private String displayName(String name) {
        return name != null && !name.isBlank() ? name : msg("email.default.name");
    }

    private String msg(String key, Object... args) {
        return messageSource.getMessage(key, args, key, Locale.ENGLISH);
    }
}
