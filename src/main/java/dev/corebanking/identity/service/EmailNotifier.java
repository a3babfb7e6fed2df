package dev.corebanking.identity.service;

import dev.corebanking.identity.config.ResilienceConfig;
import jakarta.mail.internet.MimeMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.MessageSource;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * SMTP implementation of {@link Notifier}.
 * Subjects and body text come from {@code messages*.properties}; layout from the
 * Thymeleaf templates under {@code templates/email/}. Sending blocks, so it runs on
 * the bounded elastic scheduler and is capped by the external-call timeout.
 */
@Service
@Slf4j
public class EmailNotifier implements Notifier {

    private final JavaMailSender mailSender;
    private final EmailTemplateService templateService;
    private final MessageSource messageSource;
    private final ResilienceConfig resilience;

    @Value("${app.email.from:noreply@corebanking.dev}")
    private String fromEmail;

    @Value("${app.email.from-name:Core Banking}")
    private String fromName;

    @Value("${app.email.default-locale:en}")
    private String defaultLocaleTag;

    public EmailNotifier(JavaMailSender mailSender,
                         EmailTemplateService templateService,
                         MessageSource messageSource,
                         ResilienceConfig resilience) {
        this.mailSender = mailSender;
        this.templateService = templateService;
        this.messageSource = messageSource;
        this.resilience = resilience;
    }

    @Override
    public Mono<Void> sendVerification(String to, String name, String verificationUrl) {
        Map<String, Object> vars = new HashMap<>();
        vars.put("greeting", msg("email.greeting", name));
        vars.put("bodyText", msg("email.verification.body"));
        vars.put("actionUrl", verificationUrl);
        vars.put("buttonText", msg("email.verification.button"));
        vars.put("disclaimer", msg("email.verification.disclaimer"));
        return render(to, msg("email.verification.subject"), "verification", vars);
    }

    @Override
    public Mono<Void> sendPasswordReset(String to, String name, String resetUrl) {
        Map<String, Object> vars = new HashMap<>();
        vars.put("greeting", msg("email.greeting", name));
        vars.put("bodyText", msg("email.reset.body"));
        vars.put("actionUrl", resetUrl);
        vars.put("buttonText", msg("email.reset.button"));
        vars.put("disclaimer", msg("email.reset.disclaimer"));
        return render(to, msg("email.reset.subject"), "password-reset", vars);
    }

    @Override
    public Mono<Void> sendWelcome(String to, String name) {
        Map<String, Object> vars = new HashMap<>();
        vars.put("greeting", msg("email.greeting", name));
        vars.put("bodyText", msg("email.welcome.body"));
        return render(to, msg("email.welcome.subject"), "welcome", vars);
    }

    @Override
    public Mono<Void> sendCredentials(String to, String name, String temporaryPassword, String loginUrl) {
        Map<String, Object> vars = new HashMap<>();
        vars.put("greeting", msg("email.greeting", name));
        vars.put("bodyText", msg("email.credentials.body"));
        vars.put("emailLabel", msg("email.credentials.email-label"));
        vars.put("email", to);
        vars.put("passwordLabel", msg("email.credentials.password-label"));
        vars.put("temporaryPassword", temporaryPassword);
        vars.put("actionUrl", loginUrl);
        vars.put("buttonText", msg("email.credentials.button"));
        vars.put("disclaimer", msg("email.credentials.disclaimer"));
        return render(to, msg("email.credentials.subject"), "credentials", vars);
    }

    private Mono<Void> render(String to, String subject, String template, Map<String, Object> vars) {
        return Mono.fromCallable(() -> templateService.render(template, vars, locale()))
                .flatMap(html -> sendHtml(to, subject, html));
    }

    private Mono<Void> sendHtml(String to, String subject, String html) {
        return Mono.<Void>fromRunnable(() -> {
            try {
                MimeMessage message = mailSender.createMimeMessage();
                MimeMessageHelper helper = new MimeMessageHelper(message, true, "UTF-8");
                helper.setFrom(fromEmail, fromName);
                helper.setTo(to);
                helper.setSubject(subject);
                helper.setText(html, true);
                mailSender.send(message);
                log.debug("Email '{}' sent to {}", subject, to);
            } catch (Exception e) {
                throw new IllegalStateException("Failed to send email to " + to, e);
            }
        })
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(resilience.getExternalTimeout());
    }

    private Locale locale() {
        return Locale.forLanguageTag(defaultLocaleTag);
    }

    private String msg(String key, Object... args) {
        return messageSource.getMessage(key, args, locale());
    }
}
