package dev.corebanking.identity.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.ClassLoaderTemplateResolver;

import java.time.Clock;
import java.time.Year;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Renders notification emails from {@code classpath:/templates/email/*.html} with a
 * standalone Thymeleaf engine. Every template also sees {@code appName},
 * {@code supportEmail} and {@code year}.
 */
@Service
@Slf4j
public class EmailTemplateService {

    private final TemplateEngine templateEngine;
    private final Clock clock;
    private final String appName;
    private final String supportEmail;

    public EmailTemplateService(
            Clock clock,
            @Value("${app.name:Core Banking}") String appName,
            @Value("${app.email.support:support@corebanking.dev}") String supportEmail) {
        this.clock = clock;
        this.appName = appName;
        this.supportEmail = supportEmail;

        var resolver = new ClassLoaderTemplateResolver();
        resolver.setPrefix("templates/email/");
        resolver.setSuffix(".html");
        resolver.setTemplateMode(TemplateMode.HTML);
        resolver.setCharacterEncoding("UTF-8");
        resolver.setCacheable(true);

        this.templateEngine = new TemplateEngine();
        this.templateEngine.setTemplateResolver(resolver);
        log.debug("Email template engine ready (templates/email/)");
    }

    public String render(String templateName, Map<String, Object> variables, Locale locale) {
        Map<String, Object> merged = new HashMap<>();
        merged.put("appName", appName);
        merged.put("supportEmail", supportEmail);
        merged.put("year", Year.now(clock).getValue());
        merged.putAll(variables);
        return templateEngine.process(templateName, new Context(locale, merged));
    }
}
