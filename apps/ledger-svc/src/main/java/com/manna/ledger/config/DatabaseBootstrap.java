package com.manna.ledger.config;

import jakarta.annotation.PostConstruct;
import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.Arrays;
import java.util.stream.Collectors;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

/**
 * Applies the ledger schema and the IRS tax category seed when the database has not been
 * initialized yet (no tax_categories table). Enable with manna.db.bootstrap-enabled=true.
 */
@Component
public class DatabaseBootstrap {

    private static final Logger log = LoggerFactory.getLogger(DatabaseBootstrap.class);
    private static final String SEED_RESOURCE = "db/bootstrap/seed.sql";

    private final DataSource dataSource;
    private final boolean enabled;

    public DatabaseBootstrap(DataSource dataSource,
                             @Value("${manna.db.bootstrap-enabled:false}") boolean enabled) {
        this.dataSource = dataSource;
        this.enabled = enabled;
    }

    @PostConstruct
    void maybeBootstrap() {
        if (!enabled) {
            log.info("DB bootstrap disabled (manna.db.bootstrap-enabled=false)");
            return;
        }
        try (Connection conn = dataSource.getConnection()) {
            if (taxCategoriesTableExists(conn)) {
                log.info("DB bootstrap skipped: schema already present (tax_categories table exists)");
                return;
            }
            log.warn("DB bootstrap starting: applying ledger schema and tax category seed");
            int applied = 0;
            for (String stmt : splitStatements(loadSeedSql())) {
                String trimmed = stmt.trim();
                if (trimmed.isEmpty()) {
                    continue;
                }
                try (Statement s = conn.createStatement()) {
                    s.execute(trimmed);
                    applied++;
                } catch (Exception ex) {
                    if (trimmed.toLowerCase().startsWith("create extension")) {
                        log.warn("Ignoring extension creation failure (likely insufficient privilege): {} -> {}", trimmed, ex.getMessage());
                    } else {
                        log.error("Failed executing bootstrap statement: {}", trimmed, ex);
                        throw ex;
                    }
                }
            }
            log.info("DB bootstrap completed: {} statements applied", applied);
        } catch (Exception e) {
            log.error("DB bootstrap failed (application will continue to start)", e);
        }
    }

    private boolean taxCategoriesTableExists(Connection conn) {
        try (PreparedStatement ps = conn.prepareStatement(
                "select 1 from information_schema.tables where table_name = 'tax_categories' and table_schema = 'public'")) {
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (Exception e) {
            log.warn("Could not check for existing tables: {}", e.getMessage());
            return false;
        }
    }

    private String loadSeedSql() throws Exception {
        ClassPathResource res = new ClassPathResource(SEED_RESOURCE);
        try (BufferedReader br = new BufferedReader(new InputStreamReader(res.getInputStream(), StandardCharsets.UTF_8))) {
            return br.lines()
                    .filter(line -> !line.trim().startsWith("--"))
                    .collect(Collectors.joining("\n"));
        }
    }

    private Iterable<String> splitStatements(String sql) {
        // seed.sql has no procedural blocks and no semicolons inside literals
        return Arrays.asList(sql.split(";"));
    }
}
