package net.cronhook.integration.spring;

import net.cronhook.adapter.jdbc.repo.JdbcExecutionRepository;
import net.cronhook.adapter.jdbc.repo.JdbcJobRepository;
import net.cronhook.core.spi.Clock;
import net.cronhook.core.spi.ExecutionRepository;
import net.cronhook.core.spi.JobRepository;
import net.cronhook.core.spi.TxRunner;
import net.cronhook.integration.spring.tx.SpringTxRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;

@Configuration
public class CronhookSpringConfig {

    // 스프링 트랜잭션 위에서 도는 TxRunner
    @Bean
    public TxRunner txRunner(PlatformTransactionManager tm, DataSource ds) {
        return new SpringTxRunner(tm, ds);
    }

    // 저장소는 adapter-jdbc 구현 재사용
    @Bean public JobRepository jobRepository(Clock clock) { return new JdbcJobRepository(clock); }
    @Bean public ExecutionRepository executionRepository() { return new JdbcExecutionRepository(); }

    @Bean public Clock systemClock() { return Clock.system(); }
}
