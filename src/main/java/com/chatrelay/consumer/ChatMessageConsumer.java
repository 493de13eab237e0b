package com.chatrelay.consumer;

import com.chatrelay.dispatch.CommandDispatcher;
import com.chatrelay.dispatch.DispatchOutcome;
import com.chatrelay.error.ErrorCategory;
import com.chatrelay.metrics.Metrics;
import com.chatrelay.model.ChatMessage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

/**
 * Kafka consumer that feeds chat messages into the {@link CommandDispatcher}.
 *
 * Offsets are committed manually after processing for at-least-once delivery.
 * Payloads that do not parse into a message (including tombstones) are counted, logged and skipped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChatMessageConsumer {

    private final CommandDispatcher dispatcher;
    private final ObjectMapper objectMapper;
    private final Metrics metrics;

    @KafkaListener(
        topics = "${kafka.topics.chat-messages:chat_messages}",
        groupId = "${kafka.consumer.group-id:chat-relay-group}",
        containerFactory = "chatMessageListenerContainerFactory"
    )
    public void consumeChatMessage(ConsumerRecord<String, String> record, Acknowledgment acknowledgment) {
        log.debug("Received chat message from partition {} at offset {}",
            record.partition(), record.offset());

        ChatMessage message = null;
        String problem = "empty payload";
        try {
            if (record.value() != null) {
                message = objectMapper.readValue(record.value(), ChatMessage.class);
            }
        } catch (JsonProcessingException e) {
            problem = e.getOriginalMessage();
        }
        if (message == null) {
            // tombstones and a JSON null land here as well as unparseable text
            log.warn("Skipping malformed chat message from partition {} offset {}: {}",
                record.partition(), record.offset(), problem);
            metrics.recordError(ErrorCategory.VALIDATION);
            acknowledgment.acknowledge();
            return;
        }

        try {
            message.setPartition(record.partition());
            message.setOffset(record.offset());

            DispatchOutcome outcome = dispatcher.dispatch(message);

            acknowledgment.acknowledge();

            log.debug("Processed chat message {} from partition {} offset {}: {}",
                message.getMessageId(), record.partition(), record.offset(), outcome);

        } catch (Exception e) {
            log.error("Error processing chat message from partition {} offset {}: {}",
                record.partition(), record.offset(), record.value(), e);
            // Don't acknowledge - will be retried
            throw new RuntimeException("Failed to process chat message", e);
        }
    }
}
