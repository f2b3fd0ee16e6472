package com.giftcard.fraudguard.alert;

import com.giftcard.fraudguard.domain.FailureReason;
import com.giftcard.fraudguard.domain.FraudLog;
import com.giftcard.fraudguard.domain.LogSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for FraudWebhookNotifier delivery and retry scheduling.
 */
@ExtendWith(MockitoExtension.class)
class FraudWebhookNotifierTest {

    private static final String URL = "https://alerts.example.test/fraud";

    @Mock
    private RestTemplate restTemplate;

    @Mock
    private ScheduledExecutorService executorService;

    @Captor
    private ArgumentCaptor<HttpEntity<FraudWebhookPayload>> requestCaptor;

    private FraudWebhookNotifier notifier;

    @BeforeEach
    void setUp() {
        notifier = new FraudWebhookNotifier(restTemplate, executorService);
        ReflectionTestUtils.setField(notifier, "webhookUrl", URL);
        ReflectionTestUtils.setField(notifier, "maxRetries", 3);
        ReflectionTestUtils.setField(notifier, "retryDelayMs", 1000L);
    }

    private static FraudWebhookPayload payload() {
        return FraudWebhookPayload.builder()
                .gan("****0001")
                .ip("203.0.113.5")
                .reason(FailureReason.REUSED_CODE.name())
                .merchantId("m-1")
                .timestamp(Instant.parse("2026-03-01T10:00:00Z"))
                .build();
    }

    @Test
    void postsPayloadWithServiceUserAgent() {
        notifier.sendWithRetry(payload(), "log-1", 0);

        verify(restTemplate).postForEntity(eq(URL), requestCaptor.capture(), eq(String.class));
        assertThat(requestCaptor.getValue().getHeaders().getFirst(HttpHeaders.USER_AGENT)).isEqualTo("GiftCard-FraudGuard/1.0");
        assertThat(requestCaptor.getValue().getBody()).isEqualTo(payload());
        verifyNoInteractions(executorService);
    }

    @Test
    void failedDeliveryIsRetriedWithLinearBackoff() {
        when(restTemplate.postForEntity(eq(URL), any(), eq(String.class)))
                .thenThrow(new ResourceAccessException("connection refused"));

        notifier.sendWithRetry(payload(), "log-1", 1);

        verify(executorService).schedule(any(Runnable.class), eq(2000L), eq(TimeUnit.MILLISECONDS));
    }

    @Test
    void givesUpAfterMaxRetries() {
        when(restTemplate.postForEntity(eq(URL), any(), eq(String.class)))
                .thenThrow(new ResourceAccessException("connection refused"));

        notifier.sendWithRetry(payload(), "log-1", 3);

        verify(executorService, never()).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
    }

    @Test
    void inboundWebhookLogsAreNotEchoed() {
        notifier.notifyFraud(FraudLog.builder().id("log-2").source(LogSource.WEBHOOK).build());

        verifyNoInteractions(restTemplate, executorService);
    }

    @Test
    void disabledWithoutUrl() {
        ReflectionTestUtils.setField(notifier, "webhookUrl", "");

        notifier.notifyFraud(FraudLog.builder().id("log-3").source(LogSource.GUARD).build());

        assertThat(notifier.isEnabled()).isFalse();
        verifyNoInteractions(restTemplate, executorService);
    }
}
