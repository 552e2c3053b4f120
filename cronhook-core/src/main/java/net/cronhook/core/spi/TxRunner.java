package net.cronhook.core.spi;

import java.util.concurrent.Callable;

/** 저장소 호출을 감싸는 트랜잭션 경계. JDBC/Spring 어댑터가 구현한다. */
public interface TxRunner {
    <T> T required(Callable<T> body) throws Exception;
    <T> T requiresNew(Callable<T> body) throws Exception;

    /** 반환값 없는 본문. 검사 예외를 그대로 던질 수 있다. */
    default void run(Work body) throws Exception {
        required(() -> { body.run(); return null; });
    }

    @FunctionalInterface
    interface Work {
        void run() throws Exception;
    }

    /** 트랜잭션 없이 바로 실행 (인메모리 저장소, 테스트용) */
    static TxRunner direct() {
        return new TxRunner() {
            @Override public <T> T required(Callable<T> body) throws Exception { return body.call(); }
            @Override public <T> T requiresNew(Callable<T> body) throws Exception { return body.call(); }
        };
    }
}
