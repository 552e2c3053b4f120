package net.cronhook.bootstrap.autoconfigure;

import com.fasterxml.jackson.databind.ObjectMapper;
import net.cronhook.bootstrap.catalog.CatalogRegistrar;
import net.cronhook.bootstrap.props.CronhookProperties;
import net.cronhook.core.maintenance.RetentionService;
import net.cronhook.core.schedule.NextExecutionCalculator;
import net.cronhook.core.service.DispatchPools;
import net.cronhook.core.service.ExecutionDispatcher;
import net.cronhook.core.service.JobScheduler;
import net.cronhook.core.service.JobService;
import net.cronhook.core.service.RetryPolicy;
import net.cronhook.core.spi.Clock;
import net.cronhook.core.spi.ExecutionRepository;
import net.cronhook.core.spi.FailureAlerter;
import net.cronhook.core.spi.HttpTransport;
import net.cronhook.core.spi.JobRepository;
import net.cronhook.core.spi.Sleeper;
import net.cronhook.core.spi.TimerService;
import net.cronhook.core.spi.TxRunner;
import net.cronhook.core.timer.ScheduledExecutorTimerService;
import net.cronhook.core.transport.JdkHttpTransport;
import net.cronhook.integration.spring.CronhookSpringConfig;
import net.cronhook.integration.spring.alert.JsonLogFailureAlerter;
import net.cronhook.integration.spring.sched.CronhookSchedulers;
import net.cronhook.integration.spring.sched.SchedulerLifecycle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.ZoneId;
import java.util.concurrent.ExecutorService;

@AutoConfiguration(afterName = {
        "org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration",
        "org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration"
})
@EnableConfigurationProperties(CronhookProperties.class)
@Import(CronhookSpringConfig.class) // integration-spring: repos/tx/clock wiring
public class CronhookAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(CronhookAutoConfiguration.class);

    public static final String DISPATCH_EXECUTOR = "cronhookDispatchExecutor";
    public static final String ALERT_EXECUTOR = "cronhookAlertExecutor";

    // --- SPI 기본 구현(없으면) 제공 ---

    @Bean
    @ConditionalOnMissingBean
    public NextExecutionCalculator nextExecutionCalculator(CronhookProperties props) {
        return new NextExecutionCalculator(ZoneId.of(props.getZone()));
    }

    @Bean
    @ConditionalOnMissingBean
    public HttpTransport httpTransport(CronhookProperties props) {
        return new JdkHttpTransport(props.getDispatch().getTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public FailureAlerter failureAlerter(ObjectProvider<ObjectMapper> mapper) {
        return new JsonLogFailureAlerter(mapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public Sleeper sleeper() {
        return Sleeper.system();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(TimerService.class)
    public ScheduledExecutorTimerService timerService(CronhookProperties props) {
        return new ScheduledExecutorTimerService(props.getScheduler().getTimerThreads());
    }

    @Bean(name = DISPATCH_EXECUTOR, destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = DISPATCH_EXECUTOR)
    public ExecutorService cronhookDispatchExecutor(CronhookProperties props) {
        return DispatchPools.elastic(props.getScheduler().getDispatchThreads(), daemonThreads("cronhook-dispatch-"));
    }

    @Bean(name = ALERT_EXECUTOR, destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = ALERT_EXECUTOR)
    public ExecutorService cronhookAlertExecutor(CronhookProperties props) {
        return DispatchPools.boundedAlerts(props.getDispatch().getAlertQueueCapacity(), daemonThreads("cronhook-alert-"));
    }

    // --- 코어 서비스 조립 ---

    @Bean
    @ConditionalOnMissingBean
    public ExecutionDispatcher executionDispatcher(HttpTransport transport,
                                                   ExecutionRepository executions,
                                                   TxRunner tx,
                                                   FailureAlerter alerter,
                                                   @Qualifier(ALERT_EXECUTOR) ExecutorService alertExecutor,
                                                   Sleeper sleeper,
                                                   Clock clock,
                                                   CronhookProperties props) {
        var d = props.getDispatch();
        return new ExecutionDispatcher(transport, executions, tx, RetryPolicy.linear(d.getBaseBackoff()),
                alerter, alertExecutor, sleeper, clock, d.getTimeout(), d.getMaxAttempts());
    }

    @Bean
    @ConditionalOnMissingBean
    public JobScheduler jobScheduler(JobRepository jobs,
                                     TxRunner tx,
                                     NextExecutionCalculator calculator,
                                     ExecutionDispatcher dispatcher,
                                     TimerService timers,
                                     @Qualifier(DISPATCH_EXECUTOR) ExecutorService dispatchExecutor,
                                     Clock clock,
                                     CronhookProperties props) {
        var s = props.getScheduler();
        return new JobScheduler(jobs, tx, calculator, dispatcher, timers, dispatchExecutor, clock,
                s.getMaxTimerDelay(), s.getMaxInFlightPerJob());
    }

    @Bean
    @ConditionalOnMissingBean
    public JobService jobService(JobRepository jobs,
                                 ExecutionRepository executions,
                                 JobScheduler scheduler,
                                 TxRunner tx,
                                 Clock clock) {
        return new JobService(jobs, executions, scheduler, tx, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public RetentionService retentionService(ExecutionRepository executions, TxRunner tx, Clock clock) {
        return new RetentionService(executions, tx, clock);
    }

    // --- 기동/정리 (프로퍼티로 on/off) ---

    @Bean
    @ConditionalOnProperty(prefix = "cronhook.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
    public SchedulerLifecycle schedulerLifecycle(JobScheduler scheduler) {
        return new SchedulerLifecycle(scheduler);
    }

    @Configuration(proxyBeanMethods = false)
    @EnableScheduling
    @ConditionalOnProperty(prefix = "cronhook.retention", name = "enabled", havingValue = "true", matchIfMissing = true)
    static class RetentionSchedulingConfiguration {

        // 주기는 cronhook.retention.delay-ms 에서 읽힘. TTL 만 세터로 주입
        @Bean
        public CronhookSchedulers cronhookSchedulers(RetentionService retention, CronhookProperties props) {
            var s = new CronhookSchedulers(retention);
            s.setExecutionTtl(props.getRetention().getExecutionTtl());
            return s;
        }
    }

    @Bean
    public CatalogRegistrar catalogRegistrar(JobService service,
                                             JobScheduler scheduler,
                                             JobRepository jobs,
                                             TxRunner tx) {
        return new CatalogRegistrar(service, scheduler, jobs, tx);
    }

    @Bean
    @ConditionalOnProperty(prefix = "cronhook.catalog", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ApplicationRunner catalogRunner(CatalogRegistrar registrar, CronhookProperties props) {
        log.info("Catalog runner enabled with {} job(s)", props.getCatalog().getJobs().size());
        return args -> registrar.register(props.getCatalog());
    }

    private static CustomizableThreadFactory daemonThreads(String prefix) {
        CustomizableThreadFactory f = new CustomizableThreadFactory(prefix);
        f.setDaemon(true);
        return f;
    }
}
