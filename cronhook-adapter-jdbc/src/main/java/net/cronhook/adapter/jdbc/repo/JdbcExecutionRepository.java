package net.cronhook.adapter.jdbc.repo;

import net.cronhook.adapter.jdbc.JdbcUtil;
import net.cronhook.adapter.jdbc.TxContext;
import net.cronhook.adapter.jdbc.mapper.RowMappers;
import net.cronhook.core.model.ExecutionOutcome;
import net.cronhook.core.model.ExecutionStats;
import net.cronhook.core.spi.ExecutionRepository;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public final class JdbcExecutionRepository implements ExecutionRepository {
    public static final int MAX_ERROR_LENGTH = 2000;

    @Override
    public void create(ExecutionOutcome o) throws Exception {
        try (var ps = TxContext.require().prepareStatement("""
                INSERT INTO TB_EXECUTION
                       (EXECUTION_ID, JOB_ID, OCCURRED_AT, STATUS, HTTP_STATUS, DURATION_MS, ATTEMPTS, ERROR_MESSAGE)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            """)) {
            int i = 1;
            ps.setString(i++, o.executionId());
            ps.setString(i++, o.jobId());
            ps.setTimestamp(i++, JdbcUtil.ts(o.occurrenceTimestamp()));
            ps.setString(i++, o.status().code());
            JdbcUtil.setNullableInt(ps, i++, o.httpStatusCode());
            ps.setLong(i++, o.durationMillis());
            ps.setInt(i++, o.attempts());
            ps.setString(i, truncate(o.errorMessage()));
            ps.executeUpdate();
        }
    }

    @Override
    public List<ExecutionOutcome> findRecentByJob(String jobId, int limit) throws Exception {
        try (var ps = TxContext.require().prepareStatement("""
                SELECT *
                  FROM TB_EXECUTION
                 WHERE JOB_ID = ?
                 ORDER BY OCCURRED_AT DESC, EXECUTION_ID
                 LIMIT ?
            """)) {
            ps.setString(1, jobId);
            ps.setInt(2, limit);
            return list(ps);
        }
    }

    @Override
    public List<ExecutionOutcome> findRecent(int limit) throws Exception {
        try (var ps = TxContext.require().prepareStatement("""
                SELECT *
                  FROM TB_EXECUTION
                 ORDER BY OCCURRED_AT DESC, EXECUTION_ID
                 LIMIT ?
            """)) {
            ps.setInt(1, limit);
            return list(ps);
        }
    }

    @Override
    public ExecutionStats statsFor(String jobId) throws Exception {
        try (var ps = TxContext.require().prepareStatement("""
                SELECT COUNT(*)                                               AS TOTAL,
                       SUM(CASE WHEN STATUS = 'success' THEN 1 ELSE 0 END)    AS SUCCESS_CNT,
                       SUM(CASE WHEN STATUS = 'failure' THEN 1 ELSE 0 END)    AS FAILURE_CNT,
                       AVG(CAST(DURATION_MS AS DOUBLE PRECISION))             AS AVG_MS
                  FROM TB_EXECUTION
                 WHERE JOB_ID = ?
            """)) {
            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next() || rs.getLong("TOTAL") == 0) return ExecutionStats.empty();
                return new ExecutionStats(
                        rs.getLong("TOTAL"),
                        rs.getLong("SUCCESS_CNT"),
                        rs.getLong("FAILURE_CNT"),
                        rs.getDouble("AVG_MS"));
            }
        }
    }

    @Override
    public int deleteOlderThan(Instant threshold) throws Exception {
        try (var ps = TxContext.require().prepareStatement("""
                DELETE FROM TB_EXECUTION
                 WHERE OCCURRED_AT < ?
            """)) {
            ps.setTimestamp(1, JdbcUtil.ts(threshold));
            return ps.executeUpdate();
        }
    }

    private static String truncate(String s) {
        return s == null || s.length() <= MAX_ERROR_LENGTH ? s : s.substring(0, MAX_ERROR_LENGTH);
    }

    private static List<ExecutionOutcome> list(PreparedStatement ps) throws SQLException {
        List<ExecutionOutcome> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) out.add(RowMappers.toExecution(rs));
        }
        return out;
    }
}
