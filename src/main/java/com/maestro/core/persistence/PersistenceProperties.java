package com.maestro.core.persistence;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Database settings. Leaving {@code jdbc-url} empty keeps all state in memory.
 */
@ConfigurationProperties(prefix = "maestro.persistence")
public class PersistenceProperties {

    private String jdbcUrl;
    private String username;
    private String password;
    private int maximumPoolSize = 10;

    public String getJdbcUrl() { return jdbcUrl; }
    public void setJdbcUrl(String jdbcUrl) { this.jdbcUrl = jdbcUrl; }

    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }

    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }

    public int getMaximumPoolSize() { return maximumPoolSize; }
    public void setMaximumPoolSize(int maximumPoolSize) { this.maximumPoolSize = maximumPoolSize; }
}
