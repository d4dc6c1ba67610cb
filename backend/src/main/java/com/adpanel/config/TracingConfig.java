package com.adpanel.config;

import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpRequestInterceptor;

@Slf4j
@Configuration
public class TracingConfig {

    public static final String TRACE_ID_HEADER = "X-Trace-ID";
    public static final String TRACE_ID_MDC_KEY = "traceId";
    public static final String JOB_MDC_KEY = "job";

    @Bean
    public ClientHttpRequestInterceptor traceIdInterceptor() {
        return (request, body, execution) -> {
            String traceId = currentTraceId();
            request.getHeaders().add(TRACE_ID_HEADER, traceId);

            log.debug(
                    "Adding trace ID {} to outbound request: {} {}",
                    traceId,
                    request.getMethod(),
                    request.getURI());

            return execution.execute(request, body);
        };
    }

    public static String newTraceId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }

    private static String currentTraceId() {
        String traceId = MDC.get(TRACE_ID_MDC_KEY);
        if (traceId == null || traceId.isEmpty()) {
            traceId = newTraceId();
            MDC.put(TRACE_ID_MDC_KEY, traceId);
        }
        return traceId;
    }
}
