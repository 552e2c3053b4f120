package net.cronhook.bootstrap.catalog;

import net.cronhook.bootstrap.props.CronhookProperties;
import net.cronhook.core.model.DeliveryMode;
import net.cronhook.core.model.JobRecord;
import net.cronhook.core.model.JobUpdate;
import net.cronhook.core.schedule.ScheduleParser;
import net.cronhook.core.service.JobScheduler;
import net.cronhook.core.service.JobService;
import net.cronhook.core.spi.JobRepository;
import net.cronhook.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/** 설정의 잡 목록을 이름 기준으로 생성하거나 갱신한다 (여러 번 돌아도 결과가 같다) */
public class CatalogRegistrar {
    private static final Logger log = LoggerFactory.getLogger(CatalogRegistrar.class);

    private final JobService service;
    private final JobScheduler scheduler;
    private final JobRepository jobs;
    private final TxRunner tx;

    public CatalogRegistrar(JobService service, JobScheduler scheduler, JobRepository jobs, TxRunner tx) {
        this.service = service;
        this.scheduler = scheduler;
        this.jobs = jobs;
        this.tx = tx;
    }

    public void register(CronhookProperties.Catalog catalog) throws Exception {
        for (var def : catalog.getJobs()) {
            upsert(def);
        }
    }

    private void upsert(CronhookProperties.JobDef def) throws Exception {
        if (def.getName() == null || def.getSchedule() == null || def.getTargetUrl() == null) {
            throw new IllegalArgumentException("catalog job requires name, schedule and targetUrl: " + def);
        }
        ScheduleParser.parse(def.getSchedule());
        JobService.validateTarget(def.getTargetUrl());
        DeliveryMode mode = DeliveryMode.from(def.getDeliveryMode());

        Optional<JobRecord> existing = tx.required(() -> jobs.findActiveByName(def.getName()));
        if (existing.isEmpty()) {
            JobRecord created = service.createJob(def.getSchedule(), def.getTargetUrl(), mode, def.getName());
            log.info("Catalog registered: job='{}' id={}", def.getName(), created.jobId());
            return;
        }

        String jobId = existing.get().jobId();
        JobUpdate update = new JobUpdate(def.getSchedule().trim(), def.getTargetUrl(), mode);
        if (scheduler.nextFireTime(jobId).isPresent()) {
            service.updateJob(jobId, update);
        } else {
            // 무장 안 된 잡: 저장하고, 스케줄러가 돌고 있으면 바로 무장. 꺼져 있으면 start 때 읽힌다
            JobRecord updated = tx.required(() -> jobs.update(jobId, update));
            if (scheduler.isRunning()) scheduler.addJob(updated);
        }
        log.info("Catalog updated: job='{}' id={}", def.getName(), jobId);
    }
}
