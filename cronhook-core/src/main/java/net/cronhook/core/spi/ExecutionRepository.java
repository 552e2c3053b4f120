package net.cronhook.core.spi;

import net.cronhook.core.model.ExecutionOutcome;
import net.cronhook.core.model.ExecutionStats;

import java.time.Instant;
import java.util.List;

public interface ExecutionRepository {
    void create(ExecutionOutcome outcome) throws Exception;

    List<ExecutionOutcome> findRecentByJob(String jobId, int limit) throws Exception;  // occurrence 내림차순
    List<ExecutionOutcome> findRecent(int limit) throws Exception;

    ExecutionStats statsFor(String jobId) throws Exception;

    /** occurrence 가 threshold 이전인 기록 삭제 (보존 기간 정리) */
    int deleteOlderThan(Instant threshold) throws Exception;
}
