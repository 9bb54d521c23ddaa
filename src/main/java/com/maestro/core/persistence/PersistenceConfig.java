package com.maestro.core.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.sql.SQLException;

/**
 * Provides the {@link ExecutionRepository} bean.
 * <p>
 * When {@code maestro.persistence.jdbc-url} is set, a pooled {@link JdbcExecutionRepository}
 * is created and its tables are ensured on startup. Otherwise an in-memory repository is
 * used as a fallback, suitable for development and testing but not durable across restarts.
 */
@Configuration
@EnableConfigurationProperties(PersistenceProperties.class)
public class PersistenceConfig {

    private static final Logger log = LoggerFactory.getLogger(PersistenceConfig.class);

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(prefix = "maestro.persistence", name = "jdbc-url")
    public HikariDataSource maestroDataSource(PersistenceProperties properties) {
        var config = new HikariConfig();
        config.setJdbcUrl(properties.getJdbcUrl());
        config.setUsername(properties.getUsername());
        config.setPassword(properties.getPassword());
        config.setMaximumPoolSize(properties.getMaximumPoolSize());
        config.setPoolName("maestro-db");
        return new HikariDataSource(config);
    }

    @Bean
    @ConditionalOnProperty(prefix = "maestro.persistence", name = "jdbc-url")
    public ExecutionRepository jdbcExecutionRepository(HikariDataSource maestroDataSource,
                                                       ObjectMapper objectMapper) throws SQLException {
        log.info("Configuring JDBC execution repository");
        var repository = new JdbcExecutionRepository(maestroDataSource, objectMapper);
        repository.createTables();
        return repository;
    }

    @Bean
    @ConditionalOnMissingBean(ExecutionRepository.class)
    public ExecutionRepository inMemoryExecutionRepository() {
        log.info("No database configured; using in-memory execution repository (state will not persist across restarts)");
        return new InMemoryExecutionRepository();
    }
}
