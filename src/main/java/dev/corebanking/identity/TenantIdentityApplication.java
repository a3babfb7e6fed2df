package dev.corebanking.identity;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TenantIdentityApplication {

    public static void main(String[] args) {
        SpringApplication.run(TenantIdentityApplication.class, args);
    }
}
