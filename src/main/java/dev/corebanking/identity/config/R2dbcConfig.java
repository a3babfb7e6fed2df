package dev.corebanking.identity.config;

import io.r2dbc.spi.ConnectionFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.r2dbc.repository.config.EnableR2dbcRepositories;
import org.springframework.r2dbc.connection.init.ConnectionFactoryInitializer;
import org.springframework.r2dbc.connection.init.ResourceDatabasePopulator;

/**
 * Control-plane (master) database wiring. The connection factory itself is
 * auto-configured from {@code spring.r2dbc.*}; tenant databases never go through it.
 */
@Configuration(proxyBeanMethods = false)
@EnableR2dbcRepositories(basePackages = "dev.corebanking.identity.repository")
public class R2dbcConfig {

    @Value("${app.schema.master-file:schema-master.sql}")
    private String schemaFile;

    /**
     * Initialise the tenant registry schema on startup.
     * Disabled by default; production schemas are applied by the provisioning tooling.
     */
    @Bean
    @ConditionalOnProperty(name = "app.schema.init", havingValue = "true", matchIfMissing = false)
    public ConnectionFactoryInitializer masterSchemaInitializer(ConnectionFactory connectionFactory) {
        ConnectionFactoryInitializer initializer = new ConnectionFactoryInitializer();
        initializer.setConnectionFactory(connectionFactory);
        initializer.setDatabasePopulator(new ResourceDatabasePopulator(new ClassPathResource(schemaFile)));
        return initializer;
    }
}
