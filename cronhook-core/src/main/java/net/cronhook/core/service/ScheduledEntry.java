package net.cronhook.core.service;

import net.cronhook.core.model.JobRecord;
import net.cronhook.core.schedule.ScheduleSpec;
import net.cronhook.core.spi.TimerService.TimerHandle;

import java.time.Instant;

/**
 * jobId 당 하나. 갱신은 통째로 교체한다.
 * generation 은 타이머 콜백이 자기가 무장된 엔트리인지 확인하는 데 쓴다 (교체/삭제된 뒤의 발화는 무시).
 */
record ScheduledEntry(
        JobRecord job,
        ScheduleSpec spec,
        Instant nextFireAt,
        long generation,
        TimerHandle timer
) {}
