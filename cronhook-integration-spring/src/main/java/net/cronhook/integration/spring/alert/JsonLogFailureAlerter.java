package net.cronhook.integration.spring.alert;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.cronhook.core.model.FailureAlert;
import net.cronhook.core.spi.FailureAlerter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/** 실패 알림을 한 줄 JSON 으로 ERROR 로그에 남긴다. 외부 전송 채널로 바꿀 때 이 빈만 교체. */
public class JsonLogFailureAlerter implements FailureAlerter {
    private static final Logger log = LoggerFactory.getLogger(JsonLogFailureAlerter.class);

    private final ObjectMapper mapper;

    public JsonLogFailureAlerter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public void alert(FailureAlert alert) {
        try {
            log.error("[ALERT] {}", render(alert));
        } catch (JsonProcessingException e) {
            log.error("[ALERT] job {} failed ({}); alert payload could not be rendered", alert.jobId(), alert.errorMessage(), e);
        }
    }

    String render(FailureAlert alert) throws JsonProcessingException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("type", alert.type());
        body.put("jobId", alert.jobId());
        body.put("targetUrl", alert.targetUrl());
        body.put("timestamp", alert.timestamp() == null ? null : alert.timestamp().toString());
        body.put("httpStatusCode", alert.httpStatusCode());
        body.put("durationMillis", alert.durationMillis());
        body.put("errorMessage", alert.errorMessage());
        return mapper.writeValueAsString(body);
    }
}
