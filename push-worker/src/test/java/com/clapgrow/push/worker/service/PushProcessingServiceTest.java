package com.clapgrow.push.worker.service;

import com.clapgrow.push.common.exception.PushTransportException;
import com.clapgrow.push.common.exception.PushValidationException;
import com.clapgrow.push.common.model.BackendErrorCode;
import com.clapgrow.push.common.model.MulticastResult;
import com.clapgrow.push.common.model.PushMessage;
import com.clapgrow.push.common.model.RecipientResult;
import com.clapgrow.push.common.provider.ProviderErrorCategory;
import com.clapgrow.push.worker.config.PushRetryProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PushProcessingServiceTest {

    private static final String PAYLOAD = """
        {"registration_ids":["A","B"],"data":{"title":"hello"}}
        """;

    @Mock
    private PushSender pushSender;

    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    @Mock
    private Acknowledgment acknowledgment;

    private PushProcessingService processingService;

    @BeforeEach
    void setUp() {
        PushRetryProperties retryProperties = new PushRetryProperties();
        retryProperties.setMaxRetries(4);
        processingService = new PushProcessingService(pushSender, new ObjectMapper(), kafkaTemplate, retryProperties);
        ReflectionTestUtils.setField(processingService, "dlqTopic", "notifications-push-dlq");
    }

    @Test
    void testProcess_ValidPayload_SendsWithConfiguredRetriesAndAcknowledges() {
        when(pushSender.sendWithRetry(any(PushMessage.class), eq(4))).thenReturn(MulticastResult.of(9L, List.of(
            RecipientResult.success("m-a", "A2"),
            RecipientResult.failure(BackendErrorCode.NOT_REGISTERED))));

        processingService.processPushNotification(PAYLOAD, "msg-1", acknowledgment);

        ArgumentCaptor<PushMessage> captor = ArgumentCaptor.forClass(PushMessage.class);
        verify(pushSender).sendWithRetry(captor.capture(), eq(4));
        assertEquals(List.of("A", "B"), captor.getValue().getRegistrationIds());
        assertEquals("hello", captor.getValue().getData().get("title"));
        verify(kafkaTemplate, never()).send(anyString(), anyString(), anyString());
        verify(acknowledgment).acknowledge();
    }

    @Test
    void testProcess_TransportFailure_SendsToDlqAndAcknowledges() {
        when(pushSender.sendWithRetry(any(PushMessage.class), anyInt())).thenThrow(
            new PushTransportException("GCM returned HTTP 401", ProviderErrorCategory.AUTH, 401, null));

        processingService.processPushNotification(PAYLOAD, "msg-2", acknowledgment);

        ArgumentCaptor<String> dlqPayload = ArgumentCaptor.forClass(String.class);
        verify(kafkaTemplate).send(eq("notifications-push-dlq"), eq("msg-2"), dlqPayload.capture());
        assertTrue(dlqPayload.getValue().contains("|ERROR:AUTH: GCM returned HTTP 401"));
        verify(acknowledgment).acknowledge();
    }

    @Test
    void testProcess_InvalidMessage_SendsToDlq() {
        when(pushSender.sendWithRetry(any(PushMessage.class), anyInt())).thenThrow(
            new PushValidationException("The message must specify at least one registration id"));

        processingService.processPushNotification("{\"registration_ids\":[]}", "msg-3", acknowledgment);

        verify(kafkaTemplate).send(eq("notifications-push-dlq"), eq("msg-3"), contains("at least one registration id"));
        verify(acknowledgment).acknowledge();
    }

    @Test
    void testProcess_UnparseablePayload_SendsToDlqWithoutSending() {
        processingService.processPushNotification("not-json", "msg-4", acknowledgment);

        verify(pushSender, never()).sendWithRetry(any(), anyInt());
        verify(kafkaTemplate).send(eq("notifications-push-dlq"), eq("msg-4"), startsWith("not-json|ERROR:Invalid payload"));
        verify(acknowledgment).acknowledge();
    }

    @Test
    void testProcess_UnexpectedError_SendsToDlqAndAcknowledges() {
        when(pushSender.sendWithRetry(any(PushMessage.class), anyInt())).thenThrow(
            new IllegalStateException("boom"));

        processingService.processPushNotification(PAYLOAD, "msg-5", acknowledgment);

        verify(kafkaTemplate).send(eq("notifications-push-dlq"), eq("msg-5"), contains("|ERROR:Unexpected error: boom"));
        verify(acknowledgment).acknowledge();
    }
}
