package com.manna.ledger.security;

import com.manna.ledger.config.LedgerProperties;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.UUID;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.stereotype.Component;

/**
 * Binds the acting user to the current database connection for PostgreSQL row-level security.
 */
@Component
public class RlsGuard {

    private static final Logger log = LoggerFactory.getLogger(RlsGuard.class);

    private final DataSource dataSource;
    private final boolean enabled;

    public RlsGuard(DataSource dataSource, LedgerProperties properties) {
        this.dataSource = dataSource;
        this.enabled = properties.security().rlsEnabledFlag();
    }

    public void setAppsecUser(UUID userId) {
        if (userId == null) {
            throw new IllegalArgumentException("User id is required for RLS");
        }
        if (!enabled) {
            return;
        }
        var connection = DataSourceUtils.getConnection(dataSource);
        try (Statement statement = connection.createStatement()) {
            statement.execute("SET LOCAL appsec.user_id = '" + userId + "'");
        } catch (SQLException ex) {
            log.warn("Failed to set appsec.user_id on connection: {}", ex.getMessage());
        } finally {
            DataSourceUtils.releaseConnection(connection, dataSource);
        }
    }
}
