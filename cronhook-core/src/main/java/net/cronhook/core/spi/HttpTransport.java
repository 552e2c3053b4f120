package net.cronhook.core.spi;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;

public interface HttpTransport {
    /** POST 1회. 응답 상태코드를 돌려주고, 연결/타임아웃 오류는 예외로 던진다. */
    int post(URI target, Duration timeout) throws IOException, InterruptedException;
}
