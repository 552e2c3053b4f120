package net.cronhook.integration.spring.tx;

import net.cronhook.adapter.jdbc.TxContext;
import net.cronhook.core.spi.TxRunner;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.concurrent.Callable;

/**
 * TransactionTemplate 로 경계를 잡고, 스프링이 묶어 둔 커넥션을 {@link TxContext} 에 꽂아
 * adapter-jdbc 저장소가 그대로 쓰게 한다. 검사 예외는 롤백 후 원래 타입으로 다시 던진다.
 */
public final class SpringTxRunner implements TxRunner {
    private final PlatformTransactionManager tm;
    private final DataSource ds;

    public SpringTxRunner(PlatformTransactionManager tm, DataSource ds) {
        this.tm = tm;
        this.ds = ds;
    }

    @Override
    public <T> T required(Callable<T> body) throws Exception {
        return execute(TransactionDefinition.PROPAGATION_REQUIRED, body);
    }

    @Override
    public <T> T requiresNew(Callable<T> body) throws Exception {
        return execute(TransactionDefinition.PROPAGATION_REQUIRES_NEW, body);
    }

    private <T> T execute(int propagation, Callable<T> body) throws Exception {
        var tpl = new TransactionTemplate(tm);
        tpl.setPropagationBehavior(propagation);

        try {
            return tpl.execute(status -> {
                Connection previous = TxContext.get();
                // REQUIRED 합류면 같은 커넥션, REQUIRES_NEW 면 새 커넥션이 돌아온다
                Connection con = DataSourceUtils.getConnection(ds);
                try {
                    TxContext.set(con);
                    return body.call();
                } catch (RuntimeException re) {
                    throw re;
                } catch (Exception e) {
                    throw new CheckedFailure(e);
                } finally {
                    if (previous != null) TxContext.set(previous); else TxContext.clear();
                    DataSourceUtils.releaseConnection(con, ds);
                }
            });
        } catch (CheckedFailure f) {
            throw f.failure;
        }
    }

    /** 템플릿 밖으로 검사 예외를 운반한다 (템플릿은 런타임 예외에 롤백) */
    private static final class CheckedFailure extends RuntimeException {
        final Exception failure;

        CheckedFailure(Exception cause) {
            super(cause);
            this.failure = cause;
        }
    }
}
