package com.sahayak.core.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.sql.SQLException;

/**
 * Provides the {@link AuditStore} bean.
 * <p>
 * When a {@link DataSource} is available a {@link JdbcAuditStore} is created
 * and its table ensured. Otherwise, or when the table cannot be created, an
 * {@link InMemoryAuditStore} is used, which loses all records on restart.
 */
@Configuration
public class AuditStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(AuditStoreConfig.class);

    @Bean
    public AuditStore auditStore(ObjectProvider<DataSource> dataSource) {
        DataSource ds = dataSource.getIfAvailable();
        if (ds == null) {
            log.info("No DataSource available; using in-memory audit store (records will not persist across restarts)");
            return new InMemoryAuditStore();
        }
        var store = new JdbcAuditStore(ds);
        try {
            store.createTables();
        } catch (SQLException e) {
            log.error("Could not ensure audit table, falling back to in-memory audit store: {}", e.getMessage(), e);
            return new InMemoryAuditStore();
        }
        log.info("Configuring JDBC audit store");
        return store;
    }
}
