package com.infomedia.abacox.routingreconciler.component.store;

import com.infomedia.abacox.routingreconciler.exception.StoreConnectionMissingException;
import com.infomedia.abacox.routingreconciler.exception.StoreOperationFailedException;
import com.infomedia.abacox.routingreconciler.model.EnpProfile;
import lombok.extern.log4j.Log4j2;

import java.sql.Array;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * PostgreSQL {@code numbers} table.
 */
@Log4j2
public class JdbcNumbersStore extends AbstractJdbcStore implements NumbersStore {

    static final String REASSIGN_SQL = """
            UPDATE numbers
            SET reservation_tstamp = '2050-01-01 00:00:00',
                product_id = 1,
                system_id = ?,
                nprn = ?,
                outporting_tstamp = NULL,
                lastupdated_tstamp = NOW()
            WHERE dn = ANY(?)
            RETURNING dn
            """;

    private final String dsn;

    public JdbcNumbersStore(String dsn) {
        this.dsn = dsn;
    }

    @Override
    public List<String> reassign(List<String> dns, EnpProfile profile) {
        StoreDbConfig config = resolveConfig();

        try (Connection connection = openConnection(config);
             PreparedStatement ps = connection.prepareStatement(REASSIGN_SQL)) {

            Array dnArray = connection.createArrayOf("text", dns.toArray());
            ps.setInt(1, profile.getSystemId());
            ps.setInt(2, profile.getNprnId());
            ps.setArray(3, dnArray);

            List<String> updated = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    updated.add(rs.getString(1));
                }
            }
            log.info("Reassigned {} of {} number(s) to {}", updated.size(), dns.size(), profile);
            return updated;
        } catch (SQLException e) {
            log.error("Failed to reassign numbers to {}: {}", profile, e.getMessage(), e);
            throw new StoreOperationFailedException("Numbers store update failed: " + e.getMessage(), e);
        }
    }

    private StoreDbConfig resolveConfig() {
        if (isBlank(dsn)) {
            throw new StoreConnectionMissingException("PG_DSN missing");
        }
        return PostgresDsn.toConfig(dsn);
    }
}
