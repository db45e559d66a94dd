package com.infomedia.abacox.routingreconciler.component.store;

import lombok.extern.log4j.Log4j2;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

/**
 * Shared plumbing for the stores reached over plain JDBC. A connection is
 * opened per operation and closed by the caller.
 */
@Log4j2
public abstract class AbstractJdbcStore {

    protected Connection openConnection(StoreDbConfig config) throws SQLException {
        if (config.getDriverClassName() != null) {
            try {
                Class.forName(config.getDriverClassName());
            } catch (ClassNotFoundException e) {
                log.error("Could not load JDBC driver: {}", config.getDriverClassName(), e);
                throw new SQLException("JDBC Driver not found: " + config.getDriverClassName(), e);
            }
        }

        Properties properties = new Properties();
        if (config.getUsername() != null) {
            properties.setProperty("user", config.getUsername());
        }
        if (config.getPassword() != null) {
            properties.setProperty("password", config.getPassword());
        }
        log.debug("Connecting to {}", config.getUrl());
        return DriverManager.getConnection(config.getUrl(), properties);
    }

    protected static String placeholders(int count) {
        return String.join(",", Collections.nCopies(count, "?"));
    }

    protected static void setParameters(PreparedStatement ps, List<String> values) throws SQLException {
        for (int i = 0; i < values.size(); i++) {
            ps.setString(i + 1, values.get(i));
        }
    }

    protected static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
