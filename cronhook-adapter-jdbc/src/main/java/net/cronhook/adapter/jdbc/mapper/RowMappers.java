package net.cronhook.adapter.jdbc.mapper;

import net.cronhook.adapter.jdbc.JdbcUtil;
import net.cronhook.core.model.DeliveryMode;
import net.cronhook.core.model.ExecutionOutcome;
import net.cronhook.core.model.JobRecord;
import net.cronhook.core.model.JobStatus;

import java.sql.ResultSet;
import java.sql.SQLException;

public final class RowMappers {
    private RowMappers() {}

    // --- TB_JOB ---
    public static JobRecord toJob(ResultSet rs) throws SQLException {
        return new JobRecord(
                rs.getString("JOB_ID"),
                rs.getString("NAME"),
                rs.getString("SCHEDULE"),
                rs.getString("TARGET_URL"),
                DeliveryMode.from(rs.getString("DELIVERY_MODE")),
                JobStatus.from(rs.getString("STATUS")),
                JdbcUtil.toInstant(rs.getTimestamp("CREATED_AT")),
                JdbcUtil.toInstant(rs.getTimestamp("UPDATED_AT"))
        );
    }

    // --- TB_EXECUTION ---
    public static ExecutionOutcome toExecution(ResultSet rs) throws SQLException {
        return new ExecutionOutcome(
                rs.getString("EXECUTION_ID"),
                rs.getString("JOB_ID"),
                JdbcUtil.toInstant(rs.getTimestamp("OCCURRED_AT")),
                ExecutionOutcome.Status.from(rs.getString("STATUS")),
                JdbcUtil.getNullableInt(rs, "HTTP_STATUS"),
                rs.getLong("DURATION_MS"),
                rs.getString("ERROR_MESSAGE"),
                rs.getInt("ATTEMPTS")
        );
    }
}
