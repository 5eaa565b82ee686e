package com.sandcastle.core.persistence;

import com.sandcastle.core.config.SandcastleProperties;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import javax.sql.DataSource;

/**
 * Provides the {@link SandboxRepository} bean.
 * <p>
 * When {@code sandcastle.database.url} is set, a pooled PostgreSQL
 * {@link DataSource} and a {@link JdbcSandboxRepository} are created.
 * Otherwise an {@link InMemorySandboxRepository} is used; records are then
 * lost on restart.
 */
@Configuration
public class SandboxRepositoryConfig {

    private static final Logger log = LoggerFactory.getLogger(SandboxRepositoryConfig.class);

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(name = "sandcastle.database.url")
    public HikariDataSource sandboxDataSource(SandcastleProperties properties) {
        var db = properties.getDatabase();
        var config = new HikariConfig();
        config.setJdbcUrl(db.getUrl());
        config.setUsername(db.getUsername());
        config.setPassword(db.getPassword());
        config.setMaximumPoolSize(db.getMaximumPoolSize());
        config.setPoolName("sandcastle-db");
        return new HikariDataSource(config);
    }

    /**
     * JDBC-backed repository. Creates the sandbox table on startup.
     */
    @Bean
    @Primary
    @ConditionalOnProperty(name = "sandcastle.database.url")
    public SandboxRepository jdbcSandboxRepository(DataSource sandboxDataSource) throws Exception {
        log.info("Configuring JDBC sandbox repository (PostgreSQL)");
        var repository = new JdbcSandboxRepository(sandboxDataSource);
        repository.createTables();
        return repository;
    }

    @Bean
    @ConditionalOnMissingBean(SandboxRepository.class)
    public SandboxRepository inMemorySandboxRepository() {
        log.info("No database configured; using in-memory sandbox repository (records will not persist across restarts)");
        return new InMemorySandboxRepository();
    }
}
