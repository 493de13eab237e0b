package com.chatrelay.output;

import com.chatrelay.error.RelayException;
import com.chatrelay.metrics.Metrics;
import com.chatrelay.model.CommandReply;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.KafkaException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Publishes replies as JSON to the replies topic, keyed by channel id so
 * replies to one channel keep their order.
 *
 * Every send attempt is timed and reported as an external request, whether it succeeds or not.
 */
@Slf4j
@Component
public class KafkaReplySink implements ReplySink {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final Metrics metrics;
    private final String repliesTopic;
    private final long replyTimeoutMillis;

    public KafkaReplySink(
            KafkaTemplate<String, String> kafkaTemplate,
            ObjectMapper objectMapper,
            Metrics metrics,
            @Value("${kafka.topics.chat-replies:chat_replies}") String repliesTopic,
            @Value("${relay.reply-timeout-ms:5000}") long replyTimeoutMillis
    ) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.repliesTopic = repliesTopic;
        this.replyTimeoutMillis = replyTimeoutMillis;
        log.info("Initialized KafkaReplySink on topic {} (timeout {} ms)", repliesTopic, replyTimeoutMillis);
    }

    @Override
    public void send(CommandReply reply) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(reply);
        } catch (JsonProcessingException e) {
            throw RelayException.protocol("Failed to serialize reply for channel " + reply.getChannelId(), e);
        }

        long started = System.nanoTime();
        boolean successful = false;
        try {
            kafkaTemplate.send(repliesTopic, reply.getChannelId(), payload)
                    .get(replyTimeoutMillis, TimeUnit.MILLISECONDS);
            successful = true;
            log.debug("Reply sent to channel {}", reply.getChannelId());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw RelayException.internal("Interrupted while sending reply to channel " + reply.getChannelId(), e);
        } catch (ExecutionException e) {
            throw RelayException.network("Failed to send reply to channel " + reply.getChannelId(), e.getCause());
        } catch (TimeoutException e) {
            throw RelayException.network(
                    "Timed out after " + replyTimeoutMillis + " ms sending reply to channel " + reply.getChannelId(), e);
        } catch (KafkaException e) {
            throw RelayException.network("Failed to send reply to channel " + reply.getChannelId(), e);
        } finally {
            long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
            metrics.recordExternalRequest(successful, elapsedMillis);
        }
    }
}
