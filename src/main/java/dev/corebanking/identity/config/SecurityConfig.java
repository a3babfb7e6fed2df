package dev.corebanking.identity.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.Clock;

@Configuration(proxyBeanMethods = false)
@Slf4j
public class SecurityConfig {

    @Bean
    public PasswordEncoder passwordEncoder(@Value("${security.password.bcrypt-strength:12}") int strength) {
        log.info("Using BCrypt password encoder with strength {}", strength);
        return new BCryptPasswordEncoder(strength);
    }

    /**
     * Single time source for lockout windows, token expiry and reset deadlines.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
