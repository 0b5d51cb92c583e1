package com.feedcron.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * JobStore backed by a JDBC DataSource. Definitions live in 'job_definitions'
 * (primary key job_key + job_group), their data maps in 'job_definition_data'
 * and the execution history in 'job_execution_log'. Timestamps are stored as
 * epoch milliseconds.
 */
public class JdbcJobStore implements JobStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcJobStore.class);
    private static final String DEFINITION_COLUMNS =
            "id, job_key, job_group, job_type, cron_expression, misfire_policy, paused, "
            + "created_at, last_execution_time, last_status";

    private final DataSource dataSource;

    public JdbcJobStore(DataSource dataSource) throws JobStoreException {
        this.dataSource = dataSource;
        try {
            initSchema();
        } catch (SQLException e) {
            throw new JobStoreException("Failed to create job store schema", e);
        }
    }

    private void initSchema() throws SQLException {
        try (Connection c = dataSource.getConnection();
             Statement s = c.createStatement()) {
            s.executeUpdate("CREATE TABLE IF NOT EXISTS job_definitions ("
                    + "id VARCHAR(36) NOT NULL, "
                    + "job_key VARCHAR(200) NOT NULL, "
                    + "job_group VARCHAR(200) NOT NULL, "
                    + "job_type VARCHAR(100) NOT NULL, "
                    + "cron_expression VARCHAR(120) NOT NULL, "
                    + "misfire_policy VARCHAR(40) NOT NULL, "
                    + "paused BOOLEAN NOT NULL, "
                    + "created_at BIGINT NOT NULL, "
                    + "last_execution_time BIGINT, "
                    + "last_status VARCHAR(20), "
                    + "PRIMARY KEY (job_key, job_group))");
            s.executeUpdate("CREATE TABLE IF NOT EXISTS job_definition_data ("
                    + "job_key VARCHAR(200) NOT NULL, "
                    + "job_group VARCHAR(200) NOT NULL, "
                    + "data_key VARCHAR(200) NOT NULL, "
                    + "data_value VARCHAR(4000), "
                    + "PRIMARY KEY (job_key, job_group, data_key))");
            s.executeUpdate("CREATE TABLE IF NOT EXISTS job_execution_log ("
                    + "id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, "
                    + "job_key VARCHAR(200) NOT NULL, "
                    + "job_group VARCHAR(200) NOT NULL, "
                    + "start_time BIGINT NOT NULL, "
                    + "end_time BIGINT NOT NULL, "
                    + "duration_ms BIGINT NOT NULL, "
                    + "status VARCHAR(20) NOT NULL, "
                    + "error_message VARCHAR(4000), "
                    + "stack_trace CLOB, "
                    + "items_processed INT NOT NULL)");
            s.executeUpdate("CREATE INDEX IF NOT EXISTS idx_execution_log_job "
                    + "ON job_execution_log (job_key, start_time)");
        }
    }

    @Override
    public Optional<JobDefinition> get(String jobKey, String jobGroup) throws JobStoreException {
        try (Connection c = dataSource.getConnection()) {
            return Optional.ofNullable(load(c, jobKey, jobGroup));
        } catch (SQLException | IllegalArgumentException e) {
            throw new JobStoreException("Failed to load job " + jobGroup + "." + jobKey, e);
        }
    }

    private JobDefinition load(Connection c, String jobKey, String jobGroup) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT " + DEFINITION_COLUMNS
                + " FROM job_definitions WHERE job_key = ? AND job_group = ?")) {
            ps.setString(1, jobKey);
            ps.setString(2, jobGroup);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return null;
                }
                JobDefinition.Builder b = readDefinition(rs);
                b.jobData(loadData(c, jobKey, jobGroup));
                return b.build();
            }
        }
    }

    private static JobDefinition.Builder readDefinition(ResultSet rs) throws SQLException {
        JobDefinition.Builder b = JobDefinition.builder()
                .id(rs.getString("id"))
                .jobKey(rs.getString("job_key"))
                .jobGroup(rs.getString("job_group"))
                .jobType(rs.getString("job_type"))
                .cronExpression(rs.getString("cron_expression"))
                .misfirePolicy(MisfirePolicy.parse(rs.getString("misfire_policy")))
                .paused(rs.getBoolean("paused"))
                .createdAt(Instant.ofEpochMilli(rs.getLong("created_at")));
        long last = rs.getLong("last_execution_time");
        if (!rs.wasNull()) {
            b.lastExecutionTime(Instant.ofEpochMilli(last));
        }
        String status = rs.getString("last_status");
        if (status != null) {
            b.lastStatus(ExecutionStatus.valueOf(status));
        }
        return b;
    }

    private static Map<String, String> loadData(Connection c, String jobKey, String jobGroup) throws SQLException {
        Map<String, String> data = new LinkedHashMap<>();
        try (PreparedStatement ps = c.prepareStatement("SELECT data_key, data_value FROM job_definition_data "
                + "WHERE job_key = ? AND job_group = ? ORDER BY data_key")) {
            ps.setString(1, jobKey);
            ps.setString(2, jobGroup);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    data.put(rs.getString(1), rs.getString(2));
                }
            }
        }
        return data;
    }

    @Override
    public JobDefinition upsert(JobDefinition definition) throws JobStoreException {
        try (Connection c = dataSource.getConnection()) {
            c.setAutoCommit(false);
            try {
                JobDefinition stored = upsert(c, definition);
                c.commit();
                return stored;
            } catch (SQLException e) {
                c.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new JobStoreException("Failed to store job " + definition.getJobGroup() + "."
                    + definition.getJobKey(), e);
        }
    }

    private JobDefinition upsert(Connection c, JobDefinition def) throws SQLException {
        String id = null;
        Instant createdAt = null;
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT id, created_at FROM job_definitions WHERE job_key = ? AND job_group = ? FOR UPDATE")) {
            ps.setString(1, def.getJobKey());
            ps.setString(2, def.getJobGroup());
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    id = rs.getString(1);
                    createdAt = Instant.ofEpochMilli(rs.getLong(2));
                }
            }
        }

        JobDefinition.Builder b = def.toBuilder();
        if (id != null) {
            b.id(id).createdAt(createdAt);
            try (PreparedStatement ps = c.prepareStatement("UPDATE job_definitions SET job_type = ?, "
                    + "cron_expression = ?, misfire_policy = ?, paused = ?, last_execution_time = ?, "
                    + "last_status = ? WHERE job_key = ? AND job_group = ?")) {
                ps.setString(1, def.getJobType());
                ps.setString(2, def.getCronExpression());
                ps.setString(3, def.getMisfirePolicy().name());
                ps.setBoolean(4, def.isPaused());
                setMillis(ps, 5, def.getLastExecutionTime());
                ps.setString(6, def.getLastStatus() == null ? null : def.getLastStatus().name());
                ps.setString(7, def.getJobKey());
                ps.setString(8, def.getJobGroup());
                ps.executeUpdate();
            }
        } else {
            id = UUID.randomUUID().toString();
            createdAt = def.getCreatedAt() == null ? Instant.now() : def.getCreatedAt();
            b.id(id).createdAt(createdAt);
            try (PreparedStatement ps = c.prepareStatement("INSERT INTO job_definitions ("
                    + DEFINITION_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
                ps.setString(1, id);
                ps.setString(2, def.getJobKey());
                ps.setString(3, def.getJobGroup());
                ps.setString(4, def.getJobType());
                ps.setString(5, def.getCronExpression());
                ps.setString(6, def.getMisfirePolicy().name());
                ps.setBoolean(7, def.isPaused());
                ps.setLong(8, createdAt.toEpochMilli());
                setMillis(ps, 9, def.getLastExecutionTime());
                ps.setString(10, def.getLastStatus() == null ? null : def.getLastStatus().name());
                ps.executeUpdate();
            }
        }
        replaceData(c, def.getJobKey(), def.getJobGroup(), def.getJobData());
        return b.build();
    }

    private static void replaceData(Connection c, String jobKey, String jobGroup, Map<String, String> data)
            throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "DELETE FROM job_definition_data WHERE job_key = ? AND job_group = ?")) {
            ps.setString(1, jobKey);
            ps.setString(2, jobGroup);
            ps.executeUpdate();
        }
        if (data.isEmpty()) {
            return;
        }
        try (PreparedStatement ps = c.prepareStatement("INSERT INTO job_definition_data "
                + "(job_key, job_group, data_key, data_value) VALUES (?, ?, ?, ?)")) {
            for (Map.Entry<String, String> e : data.entrySet()) {
                ps.setString(1, jobKey);
                ps.setString(2, jobGroup);
                ps.setString(3, e.getKey());
                ps.setString(4, e.getValue());
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    private static void setMillis(PreparedStatement ps, int index, Instant value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.BIGINT);
        } else {
            ps.setLong(index, value.toEpochMilli());
        }
    }

    @Override
    public boolean delete(String jobKey, String jobGroup) throws JobStoreException {
        try (Connection c = dataSource.getConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement data = c.prepareStatement(
                         "DELETE FROM job_definition_data WHERE job_key = ? AND job_group = ?");
                 PreparedStatement def = c.prepareStatement(
                         "DELETE FROM job_definitions WHERE job_key = ? AND job_group = ?")) {
                data.setString(1, jobKey);
                data.setString(2, jobGroup);
                data.executeUpdate();
                def.setString(1, jobKey);
                def.setString(2, jobGroup);
                int rows = def.executeUpdate();
                c.commit();
                return rows > 0;
            } catch (SQLException e) {
                c.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new JobStoreException("Failed to delete job " + jobGroup + "." + jobKey, e);
        }
    }

    @Override
    public List<JobDefinition> listAll() throws JobStoreException {
        List<JobDefinition.Builder> builders = new ArrayList<>();
        List<JobDefinition> list = new ArrayList<>();
        try (Connection c = dataSource.getConnection()) {
            try (PreparedStatement ps = c.prepareStatement("SELECT " + DEFINITION_COLUMNS
                    + " FROM job_definitions ORDER BY job_group, job_key");
                 ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    try {
                        builders.add(readDefinition(rs));
                    } catch (IllegalArgumentException e) {
                        log.warn("Skipping malformed job definition {}.{}: {}",
                                rs.getString("job_group"), rs.getString("job_key"), e.getMessage());
                    }
                }
            }
            for (JobDefinition.Builder b : builders) {
                JobDefinition partial = b.build();
                b.jobData(loadData(c, partial.getJobKey(), partial.getJobGroup()));
                list.add(b.build());
            }
        } catch (SQLException e) {
            throw new JobStoreException("Failed to list job definitions", e);
        }
        return list;
    }

    @Override
    public boolean updatePauseState(String jobKey, String jobGroup, boolean paused) throws JobStoreException {
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement(
                     "UPDATE job_definitions SET paused = ? WHERE job_key = ? AND job_group = ?")) {
            ps.setBoolean(1, paused);
            ps.setString(2, jobKey);
            ps.setString(3, jobGroup);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new JobStoreException("Failed to update pause state of " + jobGroup + "." + jobKey, e);
        }
    }

    @Override
    public boolean updateCronExpression(String jobKey, String jobGroup, String cronExpression)
            throws JobStoreException {
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement(
                     "UPDATE job_definitions SET cron_expression = ? WHERE job_key = ? AND job_group = ?")) {
            ps.setString(1, cronExpression);
            ps.setString(2, jobKey);
            ps.setString(3, jobGroup);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new JobStoreException("Failed to update cron expression of " + jobGroup + "." + jobKey, e);
        }
    }

    @Override
    public boolean updateLastExecution(String jobKey, String jobGroup, Instant executionTime,
                                       ExecutionStatus status) throws JobStoreException {
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement("UPDATE job_definitions SET last_execution_time = ?, "
                     + "last_status = ? WHERE job_key = ? AND job_group = ?")) {
            setMillis(ps, 1, executionTime);
            ps.setString(2, status.name());
            ps.setString(3, jobKey);
            ps.setString(4, jobGroup);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new JobStoreException("Failed to update last execution of " + jobGroup + "." + jobKey, e);
        }
    }

    @Override
    public void appendExecutionLog(ExecutionLogEntry entry) throws JobStoreException {
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement("INSERT INTO job_execution_log (job_key, job_group, "
                     + "start_time, end_time, duration_ms, status, error_message, stack_trace, items_processed) "
                     + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
            ps.setString(1, entry.getJobKey());
            ps.setString(2, entry.getJobGroup());
            ps.setLong(3, entry.getStartTime().toEpochMilli());
            ps.setLong(4, entry.getEndTime().toEpochMilli());
            ps.setLong(5, entry.getDuration().toMillis());
            ps.setString(6, entry.getStatus().name());
            ps.setString(7, truncate(entry.getErrorMessage(), 4000));
            ps.setString(8, entry.getStackTrace());
            ps.setInt(9, entry.getItemsProcessed());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new JobStoreException("Failed to append execution log for "
                    + entry.getJobGroup() + "." + entry.getJobKey(), e);
        }
    }

    private static String truncate(String s, int max) {
        return s == null || s.length() <= max ? s : s.substring(0, max);
    }

    @Override
    public List<ExecutionLogEntry> queryExecutionLog(String jobKey, int limit) throws JobStoreException {
        List<ExecutionLogEntry> list = new ArrayList<>();
        if (limit <= 0) {
            return list;
        }
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement("SELECT job_key, job_group, start_time, end_time, status, "
                     + "error_message, stack_trace, items_processed FROM job_execution_log "
                     + "WHERE job_key = ? ORDER BY start_time DESC, id DESC")) {
            ps.setString(1, jobKey);
            ps.setMaxRows(limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next() && list.size() < limit) {
                    list.add(new ExecutionLogEntry(
                            rs.getString(1),
                            rs.getString(2),
                            Instant.ofEpochMilli(rs.getLong(3)),
                            Instant.ofEpochMilli(rs.getLong(4)),
                            ExecutionStatus.valueOf(rs.getString(5)),
                            rs.getString(6),
                            rs.getString(7),
                            rs.getInt(8)));
                }
            }
        } catch (SQLException | IllegalArgumentException e) {
            throw new JobStoreException("Failed to query execution log for " + jobKey, e);
        }
        return list;
    }
}
