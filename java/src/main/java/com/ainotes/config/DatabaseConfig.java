package com.ainotes.config;

import io.r2dbc.spi.ConnectionFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.r2dbc.connection.init.ConnectionFactoryInitializer;
import org.springframework.r2dbc.connection.init.ResourceDatabasePopulator;

/**
 * Database configuration for the R2DBC PostgreSQL connection.
 */
@Configuration
public class DatabaseConfig {

    /**
     * Initialize the notes schema on startup when enabled.
     * Executes schema.sql, which is idempotent.
     */
    @Bean
    public ConnectionFactoryInitializer initializer(
            ConnectionFactory connectionFactory,
            @Value("${ainotes.database.initialize-schema:false}") boolean initializeSchema) {
        ConnectionFactoryInitializer initializer = new ConnectionFactoryInitializer();
        initializer.setConnectionFactory(connectionFactory);

        ResourceDatabasePopulator populator = new ResourceDatabasePopulator();
        populator.addScript(new ClassPathResource("schema.sql"));
        initializer.setDatabasePopulator(populator);
        initializer.setEnabled(initializeSchema);

        return initializer;
    }
}
