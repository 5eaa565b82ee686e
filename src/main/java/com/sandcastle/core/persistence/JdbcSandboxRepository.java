package com.sandcastle.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandcastle.core.error.RepositoryException;
import com.sandcastle.core.model.Sandbox;
import com.sandcastle.core.model.SandboxFilter;
import com.sandcastle.core.model.SandboxStatus;
import com.sandcastle.core.model.SandboxUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC-based {@link SandboxRepository} over a PostgreSQL table.
 * <p>
 * The table {@code sandboxes} is created by {@link #createTables()}. Addon ids
 * are stored as a JSON array; a unique index on {@code (user_id, slug)} backs
 * the per-owner slug invariant.
 */
public class JdbcSandboxRepository implements SandboxRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcSandboxRepository.class);

    private static final String TABLE_NAME = "sandboxes";

    /** SQLSTATE for unique_violation. */
    private static final String UNIQUE_VIOLATION = "23505";

    private static final String COLUMNS = """
            id, user_id, name, slug, description, repo_name, github_url, status,
            resource_tier_id, flavor_id, addon_ids, container_id, container_name,
            opencode_url, vnc_url, code_server_url, error_message,
            created_at, updated_at, last_accessed_at""";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                id               VARCHAR(32)  PRIMARY KEY,
                user_id          VARCHAR(255) NOT NULL,
                name             VARCHAR(100) NOT NULL,
                slug             VARCHAR(255) NOT NULL,
                description      VARCHAR(500),
                repo_name        VARCHAR(255) NOT NULL,
                github_url       TEXT,
                status           VARCHAR(16)  NOT NULL,
                resource_tier_id VARCHAR(64)  NOT NULL,
                flavor_id        VARCHAR(64)  NOT NULL,
                addon_ids        TEXT         NOT NULL DEFAULT '[]',
                container_id     VARCHAR(128),
                container_name   VARCHAR(255),
                opencode_url     TEXT,
                vnc_url          TEXT,
                code_server_url  TEXT,
                error_message    TEXT,
                created_at       TIMESTAMP    NOT NULL,
                updated_at       TIMESTAMP    NOT NULL,
                last_accessed_at TIMESTAMP
            )
            """.formatted(TABLE_NAME);

    private static final String CREATE_SLUG_INDEX_SQL = """
            CREATE UNIQUE INDEX IF NOT EXISTS idx_sandboxes_user_slug ON %s (user_id, slug)
            """.formatted(TABLE_NAME);

    private static final String INSERT_SQL = """
            INSERT INTO %s (%s)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """.formatted(TABLE_NAME, COLUMNS);

    private static final String SELECT_BY_ID_SQL = """
            SELECT %s FROM %s WHERE id = ?
            """.formatted(COLUMNS, TABLE_NAME);

    private static final String SELECT_SQL = """
            SELECT %s FROM %s""".formatted(COLUMNS, TABLE_NAME);

    private static final String UPDATE_STATUS_SQL = """
            UPDATE %s SET status = ?, error_message = ?, updated_at = ? WHERE id = ?
            """.formatted(TABLE_NAME);

    private static final String TOUCH_SQL = """
            UPDATE %s SET last_accessed_at = ? WHERE id = ?
            """.formatted(TABLE_NAME);

    private static final String DELETE_SQL = """
            DELETE FROM %s WHERE id = ?
            """.formatted(TABLE_NAME);

    private static final String SLUG_EXISTS_SQL = """
            SELECT 1 FROM %s WHERE user_id = ? AND slug = ?
            """.formatted(TABLE_NAME);

    private static final String COUNT_BY_STATUS_SQL = """
            SELECT status, COUNT(*) AS total FROM %s""".formatted(TABLE_NAME);

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JdbcSandboxRepository(DataSource dataSource) {
        this(dataSource, new ObjectMapper(), Clock.systemUTC());
    }

    public JdbcSandboxRepository(DataSource dataSource, ObjectMapper objectMapper, Clock clock) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Creates the sandbox table and its slug index if they do not already exist.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement table = conn.prepareStatement(CREATE_TABLE_SQL);
             PreparedStatement index = conn.prepareStatement(CREATE_SLUG_INDEX_SQL)) {
            table.execute();
            index.execute();
            log.info("Sandbox table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public boolean insert(Sandbox sandbox) {
        Instant now = clock.instant();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
            stmt.setString(1, sandbox.id());
            stmt.setString(2, sandbox.userId());
            stmt.setString(3, sandbox.name());
            stmt.setString(4, sandbox.slug());
            stmt.setString(5, sandbox.description());
            stmt.setString(6, sandbox.repoName());
            stmt.setString(7, sandbox.githubUrl());
            stmt.setString(8, sandbox.status().value());
            stmt.setString(9, sandbox.resourceTierId());
            stmt.setString(10, sandbox.flavorId());
            stmt.setString(11, toJson(sandbox.addonIds()));
            stmt.setString(12, sandbox.containerId());
            stmt.setString(13, sandbox.containerName());
            stmt.setString(14, sandbox.opencodeUrl());
            stmt.setString(15, sandbox.vncUrl());
            stmt.setString(16, sandbox.codeServerUrl());
            stmt.setString(17, sandbox.errorMessage());
            stmt.setTimestamp(18, timestamp(sandbox.createdAt() != null ? sandbox.createdAt() : now));
            stmt.setTimestamp(19, timestamp(sandbox.updatedAt() != null ? sandbox.updatedAt() : now));
            stmt.setTimestamp(20, timestamp(sandbox.lastAccessedAt()));
            return stmt.executeUpdate() == 1;
        } catch (SQLException e) {
            if (UNIQUE_VIOLATION.equals(e.getSQLState())) {
                log.debug("Sandbox {} rejected: id or slug '{}' already taken", sandbox.id(), sandbox.slug());
                return false;
            }
            throw new RepositoryException("Failed to insert sandbox " + sandbox.id(), e);
        }
    }

    @Override
    public Optional<Sandbox> getById(String id) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BY_ID_SQL)) {
            stmt.setString(1, id);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(fromResultSet(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RepositoryException("Failed to load sandbox " + id, e);
        }
    }

    @Override
    public List<Sandbox> listByUser(String userId) {
        return listAll(SandboxFilter.forUser(userId));
    }

    @Override
    public List<Sandbox> listAll(SandboxFilter filter) {
        var sql = new StringBuilder(SELECT_SQL);
        var params = new ArrayList<String>();
        appendFilter(sql, params, filter.userId(), filter.statuses().stream().map(SandboxStatus::value).sorted().toList());
        sql.append(" ORDER BY created_at DESC");

        List<Sandbox> sandboxes = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql.toString())) {
            for (int i = 0; i < params.size(); i++) {
                stmt.setString(i + 1, params.get(i));
            }
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    sandboxes.add(fromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            throw new RepositoryException("Failed to list sandboxes", e);
        }
        return sandboxes;
    }

    @Override
    public boolean updateFields(String id, SandboxUpdate update) {
        var assignments = new ArrayList<String>();
        var values = new ArrayList<Object>();
        assign(assignments, values, "name", update.name());
        assign(assignments, values, "description", update.description());
        assign(assignments, values, "status", update.status() != null ? update.status().value() : null);
        assign(assignments, values, "resource_tier_id", update.resourceTierId());
        assign(assignments, values, "flavor_id", update.flavorId());
        assign(assignments, values, "addon_ids", update.addonIds() != null ? toJson(update.addonIds()) : null);
        assign(assignments, values, "container_id", update.containerId());
        assign(assignments, values, "container_name", update.containerName());
        assign(assignments, values, "opencode_url", update.opencodeUrl());
        assign(assignments, values, "vnc_url", update.vncUrl());
        assign(assignments, values, "code_server_url", update.codeServerUrl());
        if (update.clearErrorMessage()) {
            assignments.add("error_message = NULL");
        } else {
            assign(assignments, values, "error_message", update.errorMessage());
        }
        assignments.add("updated_at = ?");
        values.add(timestamp(clock.instant()));

        String sql = "UPDATE %s SET %s WHERE id = ?".formatted(TABLE_NAME, String.join(", ", assignments));
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            int index = 1;
            for (Object value : values) {
                stmt.setObject(index++, value);
            }
            stmt.setString(index, id);
            return stmt.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RepositoryException("Failed to update sandbox " + id, e);
        }
    }

    @Override
    public boolean updateStatus(String id, SandboxStatus status, String errorMessage) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(UPDATE_STATUS_SQL)) {
            stmt.setString(1, status.value());
            stmt.setString(2, errorMessage);
            stmt.setTimestamp(3, timestamp(clock.instant()));
            stmt.setString(4, id);
            return stmt.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RepositoryException("Failed to update status of sandbox " + id, e);
        }
    }

    @Override
    public boolean touch(String id) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(TOUCH_SQL)) {
            stmt.setTimestamp(1, timestamp(clock.instant()));
            stmt.setString(2, id);
            return stmt.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RepositoryException("Failed to touch sandbox " + id, e);
        }
    }

    @Override
    public boolean delete(String id) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(DELETE_SQL)) {
            stmt.setString(1, id);
            return stmt.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RepositoryException("Failed to delete sandbox " + id, e);
        }
    }

    @Override
    public boolean slugExists(String userId, String slug) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SLUG_EXISTS_SQL)) {
            stmt.setString(1, userId);
            stmt.setString(2, slug);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new RepositoryException("Failed to check slug '%s' for user %s".formatted(slug, userId), e);
        }
    }

    @Override
    public Map<SandboxStatus, Long> countByStatus(String userId) {
        var counts = new EnumMap<SandboxStatus, Long>(SandboxStatus.class);
        for (SandboxStatus status : SandboxStatus.values()) {
            counts.put(status, 0L);
        }
        var sql = new StringBuilder(COUNT_BY_STATUS_SQL);
        var params = new ArrayList<String>();
        appendFilter(sql, params, userId, List.of());
        sql.append(" GROUP BY status");

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql.toString())) {
            for (int i = 0; i < params.size(); i++) {
                stmt.setString(i + 1, params.get(i));
            }
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    counts.put(SandboxStatus.fromValue(rs.getString("status")), rs.getLong("total"));
                }
            }
        } catch (SQLException e) {
            throw new RepositoryException("Failed to count sandboxes", e);
        }
        return counts;
    }

    // -- Helpers --

    private static void appendFilter(StringBuilder sql, List<String> params, String userId, List<String> statuses) {
        var clauses = new ArrayList<String>();
        if (userId != null) {
            clauses.add("user_id = ?");
            params.add(userId);
        }
        if (!statuses.isEmpty()) {
            clauses.add("status IN (" + String.join(", ", statuses.stream().map(s -> "?").toList()) + ")");
            params.addAll(statuses);
        }
        if (!clauses.isEmpty()) {
            sql.append(" WHERE ").append(String.join(" AND ", clauses));
        }
    }

    private static void assign(List<String> assignments, List<Object> values, String column, Object value) {
        if (value != null) {
            assignments.add(column + " = ?");
            values.add(value);
        }
    }

    private Sandbox fromResultSet(ResultSet rs) throws SQLException {
        return Sandbox.builder()
                .id(rs.getString("id"))
                .userId(rs.getString("user_id"))
                .name(rs.getString("name"))
                .slug(rs.getString("slug"))
                .description(rs.getString("description"))
                .repoName(rs.getString("repo_name"))
                .githubUrl(rs.getString("github_url"))
                .status(SandboxStatus.fromValue(rs.getString("status")))
                .resourceTierId(rs.getString("resource_tier_id"))
                .flavorId(rs.getString("flavor_id"))
                .addonIds(fromJson(rs.getString("addon_ids")))
                .containerId(rs.getString("container_id"))
                .containerName(rs.getString("container_name"))
                .opencodeUrl(rs.getString("opencode_url"))
                .vncUrl(rs.getString("vnc_url"))
                .codeServerUrl(rs.getString("code_server_url"))
                .errorMessage(rs.getString("error_message"))
                .createdAt(instant(rs.getTimestamp("created_at")))
                .updatedAt(instant(rs.getTimestamp("updated_at")))
                .lastAccessedAt(instant(rs.getTimestamp("last_accessed_at")))
                .build();
    }

    private String toJson(List<String> addonIds) {
        try {
            return objectMapper.writeValueAsString(addonIds);
        } catch (JsonProcessingException e) {
            throw new RepositoryException("Failed to serialize addon ids", e);
        }
    }

    private List<String> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            throw new RepositoryException("Unreadable addon_ids value '%s'".formatted(json), e);
        }
    }

    private static Timestamp timestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static Instant instant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
