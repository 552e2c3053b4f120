package net.cronhook.core.spi;

import net.cronhook.core.model.JobRecord;
import net.cronhook.core.model.JobUpdate;

import java.util.List;
import java.util.Optional;

public interface JobRepository {
    List<JobRecord> findAllActive() throws Exception;
    Optional<JobRecord> findById(String jobId) throws Exception;
    Optional<JobRecord> findActiveByName(String name) throws Exception;
    List<JobRecord> findAll() throws Exception;                     // 최신 생성 순

    JobRecord create(JobRecord job) throws Exception;

    /** 부분 업데이트 + ACTIVE 복귀. 없으면 JobNotFoundException */
    JobRecord update(String jobId, JobUpdate update) throws Exception;

    /** status='deleted' 로만 바꾸고 행은 남긴다 */
    void softDelete(String jobId) throws Exception;
}
