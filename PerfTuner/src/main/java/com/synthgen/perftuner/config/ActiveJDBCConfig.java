package com.synthgen.perftuner.config;

import lombok.extern.slf4j.Slf4j;
import org.javalite.activejdbc.Base;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

/**
 * ActiveJDBC Database Configuration
 *
 * Holds the telemetry database coordinates. ActiveJDBC connections are
 * bound to the calling thread, so the connection is opened lazily by the
 * thread that performs telemetry writes rather than at startup.
 */
@Configuration
@Slf4j
public class ActiveJDBCConfig {

    private final String dbUrl;
    private final String dbUsername;
    private final String dbPassword;
    private final String driverClassName;

    public ActiveJDBCConfig(@Value("${spring.datasource.url:}") String dbUrl,
                            @Value("${spring.datasource.username:}") String dbUsername,
                            @Value("${spring.datasource.password:}") String dbPassword,
                            @Value("${spring.datasource.driver-class-name:org.postgresql.Driver}") String driverClassName) {
        this.dbUrl = dbUrl;
        this.dbUsername = dbUsername;
        this.dbPassword = dbPassword;
        this.driverClassName = driverClassName;
    }

    /**
     * True when a datasource URL has been configured at all.
     */
    public boolean isConfigured() {
        return dbUrl != null && !dbUrl.isBlank();
    }

    /**
     * Opens a new database connection for the current thread.
     */
    public void openConnection() {
        if (!Base.hasConnection()) {
            try {
                Class.forName(driverClassName);
            } catch (ClassNotFoundException e) {
                throw new IllegalStateException("JDBC driver not found: " + driverClassName, e);
            }
            Base.open(driverClassName, dbUrl, dbUsername, dbPassword);
            log.info("ActiveJDBC connection opened on thread {}", Thread.currentThread().getName());
        }
    }

    /**
     * Closes the database connection for the current thread.
     */
    public void closeConnection() {
        if (Base.hasConnection()) {
            Base.close();
            log.info("ActiveJDBC connection closed on thread {}", Thread.currentThread().getName());
        }
    }

    public String getDbUrl() {
        return dbUrl;
    }
}
