package com.clapgrow.push.worker.service;

import com.clapgrow.push.common.exception.PushSendException;
import com.clapgrow.push.common.model.MulticastResult;
import com.clapgrow.push.common.model.PushMessage;
import com.clapgrow.push.common.model.RecipientResult;
import com.clapgrow.push.worker.config.PushRetryProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class PushProcessingService {

    private final PushSender pushSender;
    private final ObjectMapper objectMapper;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final PushRetryProperties retryProperties;

    @Value("${push.kafka.dlq-topic:notifications-push-dlq}")
    private String dlqTopic;

    @KafkaListener(topics = "${push.kafka.topic:notifications-push}",
        groupId = "${kafka.consumer.group-id:push-worker-group}")
    public void processPushNotification(
            @Payload String payload,
            @Header(KafkaHeaders.RECEIVED_KEY) String messageId,
            Acknowledgment acknowledgment) {

        try {
            PushMessage message = objectMapper.readValue(payload, PushMessage.class);
            int recipients = message.getRegistrationIds() != null ? message.getRegistrationIds().size() : 0;
            log.info("Processing push notification {} for {} recipient(s)", messageId, recipients);

            MulticastResult result = pushSender.sendWithRetry(message, retryProperties.getMaxRetries());
            logOutcome(messageId, message.getRegistrationIds(), result);

        } catch (JsonProcessingException e) {
            log.error("Unparseable push notification {}: {}", messageId, e.getOriginalMessage());
            sendToDLQ(messageId, payload, "Invalid payload: " + e.getOriginalMessage());
        } catch (PushSendException e) {
            log.error("Push notification {} failed ({}): {}", messageId, e.getCategory(), e.getMessage());
            sendToDLQ(messageId, payload, e.getCategory() + ": " + e.getMessage());
        } catch (Exception e) {
            log.error("Error processing push notification {}", messageId, e);
            sendToDLQ(messageId, payload, "Unexpected error: " + e.getMessage());
        }

        acknowledgment.acknowledge();
    }

    private void logOutcome(String messageId, List<String> registrationIds, MulticastResult result) {
        List<RecipientResult> results = result.results();
        for (int i = 0; i < results.size() && i < registrationIds.size(); i++) {
            RecipientResult recipient = results.get(i);
            if (recipient.hasCanonicalId()) {
                log.info("Push notification {}: registration id {} replaced by canonical id {}",
                    messageId, registrationIds.get(i), recipient.registrationId());
            } else if (!recipient.isSuccess()) {
                log.warn("Push notification {}: delivery to {} failed with {}",
                    messageId, registrationIds.get(i), recipient.error());
            }
        }
        log.info("Push notification {} processed: success={}, failure={}",
            messageId, result.success(), result.failure());
    }

    private void sendToDLQ(String messageId, String payload, String errorMessage) {
        try {
            String dlqPayload = payload + "|ERROR:" + errorMessage;
            kafkaTemplate.send(dlqTopic, messageId, dlqPayload);
            log.info("Sent failed push notification {} to DLQ", messageId);
        } catch (Exception e) {
            log.error("Failed to send push notification {} to DLQ", messageId, e);
        }
    }
}
