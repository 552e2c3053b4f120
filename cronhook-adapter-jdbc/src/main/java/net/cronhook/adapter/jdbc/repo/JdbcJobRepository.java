package net.cronhook.adapter.jdbc.repo;

import net.cronhook.adapter.jdbc.JdbcUtil;
import net.cronhook.adapter.jdbc.TxContext;
import net.cronhook.adapter.jdbc.mapper.RowMappers;
import net.cronhook.core.model.JobRecord;
import net.cronhook.core.model.JobStatus;
import net.cronhook.core.model.JobUpdate;
import net.cronhook.core.service.JobNotFoundException;
import net.cronhook.core.spi.Clock;
import net.cronhook.core.spi.JobRepository;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class JdbcJobRepository implements JobRepository {
    private final Clock clock;

    public JdbcJobRepository(Clock clock) { this.clock = clock; }

    @Override
    public List<JobRecord> findAllActive() throws Exception {
        try (var ps = TxContext.require().prepareStatement("""
                SELECT *
                  FROM TB_JOB
                 WHERE STATUS = 'active'
                 ORDER BY CREATED_AT, JOB_ID
            """)) {
            return list(ps);
        }
    }

    @Override
    public Optional<JobRecord> findById(String jobId) throws Exception {
        try (var ps = TxContext.require().prepareStatement("""
                SELECT *
                  FROM TB_JOB
                 WHERE JOB_ID = ?
            """)) {
            ps.setString(1, jobId);
            return first(ps);
        }
    }

    @Override
    public Optional<JobRecord> findActiveByName(String name) throws Exception {
        try (var ps = TxContext.require().prepareStatement("""
                SELECT *
                  FROM TB_JOB
                 WHERE NAME = ?
                   AND STATUS = 'active'
                 ORDER BY CREATED_AT DESC
            """)) {
            ps.setString(1, name);
            return first(ps);
        }
    }

    @Override
    public List<JobRecord> findAll() throws Exception {
        try (var ps = TxContext.require().prepareStatement("""
                SELECT *
                  FROM TB_JOB
                 ORDER BY CREATED_AT DESC, JOB_ID
            """)) {
            return list(ps);
        }
    }

    @Override
    public JobRecord create(JobRecord job) throws Exception {
        try (var ps = TxContext.require().prepareStatement("""
                INSERT INTO TB_JOB (JOB_ID, NAME, SCHEDULE, TARGET_URL, DELIVERY_MODE, STATUS, CREATED_AT, UPDATED_AT)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            """)) {
            int i = 1;
            ps.setString(i++, job.jobId());
            ps.setString(i++, job.name());
            ps.setString(i++, job.rawSchedule());
            ps.setString(i++, job.targetUrl());
            ps.setString(i++, job.deliveryMode().code());
            ps.setString(i++, job.status().code());
            ps.setTimestamp(i++, JdbcUtil.ts(job.createdAt()));
            ps.setTimestamp(i, JdbcUtil.ts(job.updatedAt()));
            ps.executeUpdate();
        }
        return findById(job.jobId()).orElseThrow(() -> new IllegalStateException("insert failed to load job: " + job.jobId()));
    }

    @Override
    public JobRecord update(String jobId, JobUpdate update) throws Exception {
        JobRecord current = findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        JobRecord next = current.apply(update, clock.now());

        try (var ps = TxContext.require().prepareStatement("""
                UPDATE TB_JOB
                   SET SCHEDULE      = ?,
                       TARGET_URL    = ?,
                       DELIVERY_MODE = ?,
                       STATUS        = ?,
                       UPDATED_AT    = ?
                 WHERE JOB_ID = ?
            """)) {
            int i = 1;
            ps.setString(i++, next.rawSchedule());
            ps.setString(i++, next.targetUrl());
            ps.setString(i++, next.deliveryMode().code());
            ps.setString(i++, next.status().code());
            ps.setTimestamp(i++, JdbcUtil.ts(next.updatedAt()));
            ps.setString(i, jobId);
            if (ps.executeUpdate() == 0) throw new JobNotFoundException(jobId);
        }
        return findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    @Override
    public void softDelete(String jobId) throws Exception {
        try (var ps = TxContext.require().prepareStatement("""
                UPDATE TB_JOB
                   SET STATUS = ?, UPDATED_AT = ?
                 WHERE JOB_ID = ?
            """)) {
            ps.setString(1, JobStatus.DELETED.code());
            ps.setTimestamp(2, JdbcUtil.ts(clock.now()));
            ps.setString(3, jobId);
            ps.executeUpdate();
        }
    }

    private static Optional<JobRecord> first(PreparedStatement ps) throws SQLException {
        try (ResultSet rs = ps.executeQuery()) {
            if (!rs.next()) return Optional.empty();
            return Optional.of(RowMappers.toJob(rs));
        }
    }

    private static List<JobRecord> list(PreparedStatement ps) throws SQLException {
        List<JobRecord> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) out.add(RowMappers.toJob(rs));
        }
        return out;
    }
}
