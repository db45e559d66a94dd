package com.infomedia.abacox.routingreconciler.component.store;

import com.infomedia.abacox.routingreconciler.exception.StoreConnectionMissingException;
import com.infomedia.abacox.routingreconciler.exception.StoreOperationFailedException;
import lombok.extern.log4j.Log4j2;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * MariaDB {@code cli_provisioning} table of the dispatcher.
 */
@Log4j2
public class JdbcProvisioningStore extends AbstractJdbcStore implements ProvisioningStore {

    public static final String DRIVER_CLASS_NAME = "org.mariadb.jdbc.Driver";

    private static final String SELECT_SQL =
            "SELECT id, target_number, target_system, tenant, nprn, insert_date "
                    + "FROM cli_provisioning WHERE target_number IN (%s)";
    private static final String DELETE_SQL = "DELETE FROM cli_provisioning WHERE target_number IN (%s)";

    private final String host;
    private final int port;
    private final String user;
    private final String password;
    private final String database;

    public JdbcProvisioningStore(String host, int port, String user, String password, String database) {
        this.host = host;
        this.port = port;
        this.user = user;
        this.password = password;
        this.database = database;
    }

    @Override
    public List<ProvisioningRow> findByTargets(List<String> targets) {
        StoreDbConfig config = resolveConfig();

        try (Connection connection = openConnection(config)) {
            connection.setAutoCommit(false);
            try {
                List<ProvisioningRow> rows = select(connection, targets);
                connection.rollback();
                return rows;
            } catch (SQLException | RuntimeException e) {
                rollback(connection, e);
                throw e;
            }
        } catch (SQLException e) {
            log.error("Failed to read provisioning rows: {}", e.getMessage(), e);
            throw new StoreOperationFailedException("Provisioning store read failed: " + e.getMessage(), e);
        }
    }

    @Override
    public ProvisioningCleanup deleteByTargets(List<String> targets) {
        StoreDbConfig config = resolveConfig();

        try (Connection connection = openConnection(config)) {
            connection.setAutoCommit(false);
            try {
                List<ProvisioningRow> snapshot = select(connection, targets);
                int deleted;
                try (PreparedStatement ps = connection.prepareStatement(
                        String.format(DELETE_SQL, placeholders(targets.size())))) {
                    setParameters(ps, targets);
                    deleted = ps.executeUpdate();
                }
                connection.commit();
                log.info("Deleted {} provisioning row(s), {} read before the delete", deleted, snapshot.size());
                return new ProvisioningCleanup(snapshot, deleted);
            } catch (SQLException | RuntimeException e) {
                rollback(connection, e);
                throw e;
            }
        } catch (SQLException e) {
            log.error("Failed to delete provisioning rows: {}", e.getMessage(), e);
            throw new StoreOperationFailedException("Provisioning store delete failed: " + e.getMessage(), e);
        }
    }

    private List<ProvisioningRow> select(Connection connection, List<String> targets) throws SQLException {
        List<ProvisioningRow> rows = new ArrayList<>();
        try (PreparedStatement ps = connection.prepareStatement(
                String.format(SELECT_SQL, placeholders(targets.size())))) {
            setParameters(ps, targets);
            try (ResultSet rs = ps.executeQuery()) {
                List<String> labels = columnLabels(rs.getMetaData());
                while (rs.next()) {
                    rows.add(toRow(rs, labels));
                }
            }
        }
        return rows;
    }

    private static List<String> columnLabels(ResultSetMetaData metaData) throws SQLException {
        List<String> labels = new ArrayList<>(metaData.getColumnCount());
        for (int i = 1; i <= metaData.getColumnCount(); i++) {
            String label = metaData.getColumnLabel(i);
            labels.add(label == null || label.isEmpty() ? metaData.getColumnName(i) : label);
        }
        return labels;
    }

    private static ProvisioningRow toRow(ResultSet rs, List<String> labels) throws SQLException {
        Map<String, Object> columns = new LinkedHashMap<>();
        for (int i = 0; i < labels.size(); i++) {
            Object value = rs.getObject(i + 1);
            columns.put(labels.get(i), value instanceof Timestamp ? ((Timestamp) value).toLocalDateTime() : value);
        }
        return new ProvisioningRow(columns);
    }

    private static void rollback(Connection connection, Exception cause) {
        try {
            connection.rollback();
            log.warn("Provisioning transaction rolled back");
        } catch (SQLException rollbackError) {
            cause.addSuppressed(rollbackError);
        }
    }

    private StoreDbConfig resolveConfig() {
        if (isBlank(host) || isBlank(user) || isBlank(database)) {
            throw new StoreConnectionMissingException("MariaDB env missing");
        }
        return StoreDbConfig.builder()
                .url(String.format("jdbc:mariadb://%s:%d/%s", host, port, database))
                .username(user)
                .password(password)
                .driverClassName(DRIVER_CLASS_NAME)
                .build();
    }
}
