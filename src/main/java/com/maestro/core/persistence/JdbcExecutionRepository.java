package com.maestro.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.maestro.core.model.AuditRecord;
import com.maestro.core.model.CommunicationRecord;
import com.maestro.core.model.Execution;
import com.maestro.core.model.ExecutionMode;
import com.maestro.core.model.ExecutionNotFoundException;
import com.maestro.core.model.ExecutionStatus;
import com.maestro.core.model.PersistenceException;
import com.maestro.core.model.Step;
import com.maestro.core.model.StepStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * JDBC-based {@link ExecutionRepository} for PostgreSQL.
 * <p>
 * Executions, steps, audit records and communications each live in their own table, created
 * by {@link #createTables()}. Status changes are compare-and-set updates on the status column,
 * so two writers racing on the same row cannot both win.
 */
public class JdbcExecutionRepository implements ExecutionRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcExecutionRepository.class);

    private static final int MAX_CAS_ATTEMPTS = 5;

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    private static final TypeReference<Map<String, Object>> CONTEXT_MAP = new TypeReference<>() {};

    private static final List<String> CREATE_TABLES_SQL = List.of("""
            CREATE TABLE IF NOT EXISTS maestro_executions (
                id              VARCHAR(255) PRIMARY KEY,
                template_id     VARCHAR(255),
                mode            VARCHAR(32) NOT NULL,
                working_context TEXT NOT NULL,
                status          VARCHAR(32) NOT NULL,
                created_at      TIMESTAMPTZ NOT NULL,
                started_at      TIMESTAMPTZ,
                completed_at    TIMESTAMPTZ
            )
            """, """
            CREATE TABLE IF NOT EXISTS maestro_steps (
                execution_id    VARCHAR(255) NOT NULL REFERENCES maestro_executions(id) ON DELETE CASCADE,
                step_id         VARCHAR(255) NOT NULL,
                position        INT NOT NULL,
                agent_id        VARCHAR(255) NOT NULL,
                task_text       TEXT NOT NULL,
                depends_on      TEXT NOT NULL,
                status          VARCHAR(32) NOT NULL,
                started_at      TIMESTAMPTZ,
                completed_at    TIMESTAMPTZ,
                result          TEXT,
                error           TEXT,
                retry_count     INT NOT NULL DEFAULT 0,
                timeout_seconds INT,
                PRIMARY KEY (execution_id, step_id)
            )
            """, """
            CREATE TABLE IF NOT EXISTS maestro_audit (
                seq          BIGSERIAL PRIMARY KEY,
                execution_id VARCHAR(255) NOT NULL,
                step_id      VARCHAR(255),
                agent_id     VARCHAR(255),
                action       VARCHAR(64) NOT NULL,
                status       VARCHAR(32),
                message      TEXT,
                ts           TIMESTAMPTZ NOT NULL
            )
            """, """
            CREATE TABLE IF NOT EXISTS maestro_communications (
                seq          BIGSERIAL,
                id           VARCHAR(512) PRIMARY KEY,
                execution_id VARCHAR(255) NOT NULL,
                step_id      VARCHAR(255) NOT NULL,
                from_agent   VARCHAR(255) NOT NULL,
                to_agent     VARCHAR(255) NOT NULL,
                message      TEXT NOT NULL,
                response     TEXT,
                ts           TIMESTAMPTZ NOT NULL,
                responded_at TIMESTAMPTZ
            )
            """,
            "CREATE INDEX IF NOT EXISTS maestro_audit_execution_idx ON maestro_audit (execution_id)",
            "CREATE INDEX IF NOT EXISTS maestro_audit_agent_idx ON maestro_audit (agent_id)");

    private static final String UPSERT_EXECUTION_SQL = """
            INSERT INTO maestro_executions (id, template_id, mode, working_context, status, created_at, started_at, completed_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (id)
            DO UPDATE SET template_id = EXCLUDED.template_id,
                          mode = EXCLUDED.mode,
                          working_context = EXCLUDED.working_context,
                          status = EXCLUDED.status,
                          started_at = EXCLUDED.started_at,
                          completed_at = EXCLUDED.completed_at
            """;

    private static final String DELETE_STEPS_SQL = "DELETE FROM maestro_steps WHERE execution_id = ?";

    private static final String INSERT_STEP_SQL = """
            INSERT INTO maestro_steps (execution_id, step_id, position, agent_id, task_text, depends_on, status,
                                       started_at, completed_at, result, error, retry_count, timeout_seconds)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String SELECT_EXECUTION_SQL = """
            SELECT id, template_id, mode, working_context, status, created_at, started_at, completed_at
            FROM maestro_executions WHERE id = ?
            """;

    private static final String SELECT_ALL_EXECUTIONS_SQL = """
            SELECT id, template_id, mode, working_context, status, created_at, started_at, completed_at
            FROM maestro_executions ORDER BY created_at DESC
            """;

    private static final String SELECT_STEPS_SQL = """
            SELECT step_id, execution_id, agent_id, task_text, depends_on, status, started_at, completed_at,
                   result, error, retry_count, timeout_seconds
            FROM maestro_steps WHERE execution_id = ? ORDER BY position ASC
            """;

    private static final String SELECT_STEP_SQL = """
            SELECT step_id, execution_id, agent_id, task_text, depends_on, status, started_at, completed_at,
                   result, error, retry_count, timeout_seconds
            FROM maestro_steps WHERE execution_id = ? AND step_id = ?
            """;

    private static final String CAS_EXECUTION_STATUS_SQL = """
            UPDATE maestro_executions SET status = ?, started_at = ?, completed_at = ?
            WHERE id = ? AND status = ?
            """;

    private static final String CAS_STEP_SQL = """
            UPDATE maestro_steps SET status = ?, started_at = ?, completed_at = ?, result = ?, error = ?, retry_count = ?
            WHERE execution_id = ? AND step_id = ? AND status = ?
            """;

    private static final String INSERT_AUDIT_SQL = """
            INSERT INTO maestro_audit (execution_id, step_id, agent_id, action, status, message, ts)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            RETURNING seq
            """;

    private static final String AUDIT_COLUMNS = "seq, execution_id, step_id, agent_id, action, status, message, ts";

    private static final String INSERT_COMMUNICATION_SQL = """
            INSERT INTO maestro_communications (id, execution_id, step_id, from_agent, to_agent, message, response, ts, responded_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (id) DO NOTHING
            """;

    private static final String COMMUNICATION_COLUMNS =
            "id, execution_id, step_id, from_agent, to_agent, message, response, ts, responded_at";

    private static final String ATTACH_RESPONSE_SQL = """
            UPDATE maestro_communications SET response = ?, responded_at = ?
            WHERE id = ? AND response IS NULL
            """;

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public JdbcExecutionRepository(DataSource dataSource, ObjectMapper objectMapper) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = objectMapper;
    }

    /**
     * Creates the tables if they do not already exist.
     * Should be called once during application startup.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            for (String sql : CREATE_TABLES_SQL) {
                try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                    stmt.execute();
                }
            }
        }
        log.info("Maestro tables ensured");
    }

    @Override
    public void save(Execution execution) {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                try (PreparedStatement stmt = conn.prepareStatement(UPSERT_EXECUTION_SQL)) {
                    stmt.setString(1, execution.id());
                    stmt.setString(2, execution.templateId());
                    stmt.setString(3, execution.mode().name());
                    stmt.setString(4, toJson(execution.workingContext()));
                    stmt.setString(5, execution.status().name());
                    setInstant(stmt, 6, execution.createdAt());
                    setInstant(stmt, 7, execution.startedAt());
                    setInstant(stmt, 8, execution.completedAt());
                    stmt.executeUpdate();
                }
                try (PreparedStatement stmt = conn.prepareStatement(DELETE_STEPS_SQL)) {
                    stmt.setString(1, execution.id());
                    stmt.executeUpdate();
                }
                try (PreparedStatement stmt = conn.prepareStatement(INSERT_STEP_SQL)) {
                    int position = 0;
                    for (Step step : execution.steps()) {
                        stmt.setString(1, execution.id());
                        stmt.setString(2, step.id());
                        stmt.setInt(3, position++);
                        stmt.setString(4, step.agentId());
                        stmt.setString(5, step.taskText());
                        stmt.setString(6, toJson(step.dependsOn()));
                        stmt.setString(7, step.status().name());
                        setInstant(stmt, 8, step.startedAt());
                        setInstant(stmt, 9, step.completedAt());
                        stmt.setString(10, step.result());
                        stmt.setString(11, step.error());
                        stmt.setInt(12, step.retryCount());
                        if (step.timeoutSeconds() != null) {
                            stmt.setInt(13, step.timeoutSeconds());
                        } else {
                            stmt.setNull(13, Types.INTEGER);
                        }
                        stmt.addBatch();
                    }
                    stmt.executeBatch();
                }
                conn.commit();
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to save execution " + execution.id(), e);
        }
    }

    @Override
    public Optional<Execution> findById(String executionId) {
        try (Connection conn = dataSource.getConnection()) {
            return loadExecution(conn, executionId);
        } catch (SQLException e) {
            throw new PersistenceException("Failed to load execution " + executionId, e);
        }
    }

    @Override
    public List<Execution> findAll() {
        List<Execution> result = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_ALL_EXECUTIONS_SQL);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                String id = rs.getString("id");
                result.add(executionFromRow(rs, loadSteps(conn, id)));
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to list executions", e);
        }
        return result;
    }

    @Override
    public Optional<Execution> updateExecutionStatus(String executionId, ExecutionStatus to, Instant at) {
        try (Connection conn = dataSource.getConnection()) {
            for (int attempt = 0; attempt < MAX_CAS_ATTEMPTS; attempt++) {
                Execution current = loadExecution(conn, executionId)
                        .orElseThrow(() -> new ExecutionNotFoundException(executionId));
                if (!current.status().canTransitionTo(to)) {
                    return Optional.empty();
                }
                Execution updated = current.withStatus(to, at);
                try (PreparedStatement stmt = conn.prepareStatement(CAS_EXECUTION_STATUS_SQL)) {
                    stmt.setString(1, to.name());
                    setInstant(stmt, 2, updated.startedAt());
                    setInstant(stmt, 3, updated.completedAt());
                    stmt.setString(4, executionId);
                    stmt.setString(5, current.status().name());
                    if (stmt.executeUpdate() == 1) {
                        return Optional.of(updated);
                    }
                }
                log.debug("Concurrent status change on execution {}, retrying", executionId);
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new PersistenceException("Failed to update status of execution " + executionId, e);
        }
    }

    @Override
    public Optional<Step> transitionStep(String executionId, String stepId, StepStatus to,
                                         UnaryOperator<Step> change) {
        try (Connection conn = dataSource.getConnection()) {
            for (int attempt = 0; attempt < MAX_CAS_ATTEMPTS; attempt++) {
                Optional<Step> loaded = loadStep(conn, executionId, stepId);
                if (loaded.isEmpty()) {
                    if (loadExecution(conn, executionId).isEmpty()) {
                        throw new ExecutionNotFoundException(executionId);
                    }
                    return Optional.empty();
                }
                Step current = loaded.get();
                if (!current.status().canTransitionTo(to)) {
                    return Optional.empty();
                }
                Step updated = change.apply(current.withStatus(to));
                try (PreparedStatement stmt = conn.prepareStatement(CAS_STEP_SQL)) {
                    stmt.setString(1, updated.status().name());
                    setInstant(stmt, 2, updated.startedAt());
                    setInstant(stmt, 3, updated.completedAt());
                    stmt.setString(4, updated.result());
                    stmt.setString(5, updated.error());
                    stmt.setInt(6, updated.retryCount());
                    stmt.setString(7, executionId);
                    stmt.setString(8, stepId);
                    stmt.setString(9, current.status().name());
                    if (stmt.executeUpdate() == 1) {
                        return Optional.of(updated);
                    }
                }
                log.debug("Concurrent status change on step {}/{}, retrying", executionId, stepId);
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new PersistenceException("Failed to update step " + stepId + " of execution " + executionId, e);
        }
    }

    @Override
    public AuditRecord appendAudit(AuditRecord record) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_AUDIT_SQL)) {
            stmt.setString(1, record.executionId());
            stmt.setString(2, record.stepId());
            stmt.setString(3, record.agentId());
            stmt.setString(4, record.action());
            stmt.setString(5, record.status());
            stmt.setString(6, record.message());
            setInstant(stmt, 7, record.timestamp());
            try (ResultSet rs = stmt.executeQuery()) {
                rs.next();
                long seq = rs.getLong(1);
                return new AuditRecord("AUD-" + seq, seq, record.executionId(), record.stepId(), record.agentId(),
                        record.action(), record.status(), record.message(), record.timestamp());
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to append audit record for execution " + record.executionId(), e);
        }
    }

    @Override
    public List<AuditRecord> findAuditByExecution(String executionId) {
        return queryAudit("SELECT " + AUDIT_COLUMNS + " FROM maestro_audit WHERE execution_id = ? ORDER BY ts ASC, seq ASC",
                stmt -> stmt.setString(1, executionId));
    }

    @Override
    public List<AuditRecord> findAuditByAgent(String agentId, int limit) {
        return queryAudit("SELECT " + AUDIT_COLUMNS + " FROM maestro_audit WHERE agent_id = ? ORDER BY ts DESC, seq DESC LIMIT ?",
                stmt -> {
                    stmt.setString(1, agentId);
                    stmt.setInt(2, Math.max(0, limit));
                });
    }

    @Override
    public List<AuditRecord> findAuditBetween(Instant from, Instant to) {
        return queryAudit("SELECT " + AUDIT_COLUMNS + " FROM maestro_audit"
                        + " WHERE (CAST(? AS TIMESTAMPTZ) IS NULL OR ts >= ?) AND (CAST(? AS TIMESTAMPTZ) IS NULL OR ts < ?)"
                        + " ORDER BY ts ASC, seq ASC",
                stmt -> {
                    setInstant(stmt, 1, from);
                    setInstant(stmt, 2, from);
                    setInstant(stmt, 3, to);
                    setInstant(stmt, 4, to);
                });
    }

    @Override
    public boolean saveCommunication(CommunicationRecord record) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_COMMUNICATION_SQL)) {
            stmt.setString(1, record.id());
            stmt.setString(2, record.executionId());
            stmt.setString(3, record.stepId());
            stmt.setString(4, record.fromAgent());
            stmt.setString(5, record.toAgent());
            stmt.setString(6, record.message());
            stmt.setString(7, record.response());
            setInstant(stmt, 8, record.timestamp());
            setInstant(stmt, 9, record.respondedAt());
            return stmt.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new PersistenceException("Failed to save communication " + record.id(), e);
        }
    }

    @Override
    public Optional<CommunicationRecord> findCommunication(String communicationId) {
        try (Connection conn = dataSource.getConnection()) {
            return loadCommunication(conn, communicationId);
        } catch (SQLException e) {
            throw new PersistenceException("Failed to load communication " + communicationId, e);
        }
    }

    @Override
    public Optional<CommunicationRecord> attachResponse(String communicationId, String response, Instant at) {
        try (Connection conn = dataSource.getConnection()) {
            try (PreparedStatement stmt = conn.prepareStatement(ATTACH_RESPONSE_SQL)) {
                stmt.setString(1, response);
                setInstant(stmt, 2, at);
                stmt.setString(3, communicationId);
                if (stmt.executeUpdate() == 0) {
                    return Optional.empty();
                }
            }
            return loadCommunication(conn, communicationId);
        } catch (SQLException e) {
            throw new PersistenceException("Failed to attach response to communication " + communicationId, e);
        }
    }

    @Override
    public List<CommunicationRecord> findCommunicationsByExecution(String executionId) {
        List<CommunicationRecord> result = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(
                     "SELECT " + COMMUNICATION_COLUMNS + " FROM maestro_communications WHERE execution_id = ? ORDER BY seq ASC")) {
            stmt.setString(1, executionId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    result.add(communicationFromRow(rs));
                }
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to list communications of execution " + executionId, e);
        }
        return result;
    }

    // --- Row mapping ---

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement stmt) throws SQLException;
    }

    private List<AuditRecord> queryAudit(String sql, Binder binder) {
        List<AuditRecord> result = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            binder.bind(stmt);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    long seq = rs.getLong("seq");
                    result.add(new AuditRecord("AUD-" + seq, seq,
                            rs.getString("execution_id"),
                            rs.getString("step_id"),
                            rs.getString("agent_id"),
                            rs.getString("action"),
                            rs.getString("status"),
                            rs.getString("message"),
                            getInstant(rs, "ts")));
                }
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to query audit records", e);
        }
        return result;
    }

    private Optional<Execution> loadExecution(Connection conn, String executionId) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(SELECT_EXECUTION_SQL)) {
            stmt.setString(1, executionId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(executionFromRow(rs, loadSteps(conn, executionId)));
            }
        }
    }

    private Execution executionFromRow(ResultSet rs, List<Step> steps) throws SQLException {
        return new Execution(
                rs.getString("id"),
                rs.getString("template_id"),
                ExecutionMode.valueOf(rs.getString("mode")),
                fromJson(rs.getString("working_context"), CONTEXT_MAP),
                ExecutionStatus.valueOf(rs.getString("status")),
                getInstant(rs, "created_at"),
                getInstant(rs, "started_at"),
                getInstant(rs, "completed_at"),
                steps);
    }

    private List<Step> loadSteps(Connection conn, String executionId) throws SQLException {
        List<Step> steps = new ArrayList<>();
        try (PreparedStatement stmt = conn.prepareStatement(SELECT_STEPS_SQL)) {
            stmt.setString(1, executionId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    steps.add(stepFromRow(rs));
                }
            }
        }
        return steps;
    }

    private Optional<Step> loadStep(Connection conn, String executionId, String stepId) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(SELECT_STEP_SQL)) {
            stmt.setString(1, executionId);
            stmt.setString(2, stepId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(stepFromRow(rs)) : Optional.empty();
            }
        }
    }

    private Step stepFromRow(ResultSet rs) throws SQLException {
        int timeout = rs.getInt("timeout_seconds");
        Integer timeoutSeconds = rs.wasNull() ? null : timeout;
        return new Step(
                rs.getString("step_id"),
                rs.getString("execution_id"),
                rs.getString("agent_id"),
                rs.getString("task_text"),
                fromJson(rs.getString("depends_on"), STRING_LIST),
                StepStatus.valueOf(rs.getString("status")),
                getInstant(rs, "started_at"),
                getInstant(rs, "completed_at"),
                rs.getString("result"),
                rs.getString("error"),
                rs.getInt("retry_count"),
                timeoutSeconds);
    }

    private Optional<CommunicationRecord> loadCommunication(Connection conn, String communicationId) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(
                "SELECT " + COMMUNICATION_COLUMNS + " FROM maestro_communications WHERE id = ?")) {
            stmt.setString(1, communicationId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(communicationFromRow(rs)) : Optional.empty();
            }
        }
    }

    private CommunicationRecord communicationFromRow(ResultSet rs) throws SQLException {
        return new CommunicationRecord(
                rs.getString("id"),
                rs.getString("execution_id"),
                rs.getString("step_id"),
                rs.getString("from_agent"),
                rs.getString("to_agent"),
                rs.getString("message"),
                rs.getString("response"),
                getInstant(rs, "ts"),
                getInstant(rs, "responded_at"));
    }

    private static void setInstant(PreparedStatement stmt, int index, Instant value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.TIMESTAMP_WITH_TIMEZONE);
        } else {
            stmt.setTimestamp(index, Timestamp.from(value));
        }
    }

    private static Instant getInstant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts != null ? ts.toInstant() : null;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to deserialize stored JSON", e);
        }
    }
}
