package org.iceforge.efsguard.jdbc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.Driver;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Map;
import java.util.Properties;

/**
 * Opens connections with the {@link Driver} registered for the configured URL; the JDBC driver
 * (sqlite-jdbc by default) only has to be on the classpath.
 */
public class DriverManagerConnectionFactory implements ConnectionFactory {

    private static final Logger log = LoggerFactory.getLogger(DriverManagerConnectionFactory.class);

    private final String url;
    private final Properties connectionProperties;

    public DriverManagerConnectionFactory(EfsGuardJdbcProperties cfg) {
        if (cfg.getJdbcUrl() == null || cfg.getJdbcUrl().isBlank()) {
            throw new IllegalArgumentException("efsguard.datasource.jdbc-url is required");
        }
        this.url = cfg.getJdbcUrl();
        this.connectionProperties = toProperties(cfg);
    }

    @Override
    public Connection open(int loginTimeoutSeconds) throws SQLException {
        Driver driver = DriverManager.getDriver(url);
        // DriverManager's login timeout is JVM-wide; drivers read it while connecting.
        if (loginTimeoutSeconds > 0 && DriverManager.getLoginTimeout() != loginTimeoutSeconds) {
            log.debug("Setting JDBC login timeout to {}s", loginTimeoutSeconds);
            DriverManager.setLoginTimeout(loginTimeoutSeconds);
        }
        Connection conn = driver.connect(url, (Properties) connectionProperties.clone());
        if (conn == null) {
            throw new SQLException("Driver " + driver.getClass().getName() + " rejected URL " + url);
        }
        return conn;
    }

    Properties connectionProperties() {
        return (Properties) connectionProperties.clone();
    }

    private static Properties toProperties(EfsGuardJdbcProperties cfg) {
        Properties props = new Properties();
        Map<String, String> m = cfg.getProperties();
        if (m != null) {
            m.forEach((k, v) -> {
                if (k != null && v != null) props.setProperty(k, v);
            });
        }
        if (cfg.getUsername() != null && !cfg.getUsername().isBlank()) {
            props.setProperty("user", cfg.getUsername());
            if (cfg.getPassword() != null) {
                props.setProperty("password", cfg.getPassword());
            }
        }
        return props;
    }
}
