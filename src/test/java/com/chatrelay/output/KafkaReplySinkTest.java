package com.chatrelay.output;

import com.chatrelay.config.KafkaConfig;
import com.chatrelay.error.ErrorCategory;
import com.chatrelay.error.RelayException;
import com.chatrelay.metrics.MetricsRegistry;
import com.chatrelay.model.CommandReply;
import com.chatrelay.model.ReplyField;
import com.chatrelay.testutil.MutableClock;
import com.chatrelay.testutil.TestFactory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.KafkaException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class KafkaReplySinkTest {

    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    private final ObjectMapper objectMapper = new KafkaConfig().objectMapper();
    private final MetricsRegistry metrics = TestFactory.registry(new MutableClock(TestFactory.START));
    private KafkaReplySink sink;

    @BeforeEach
    void setUp() {
        sink = new KafkaReplySink(kafkaTemplate, objectMapper, metrics, "chat_replies", 200);
    }

    private static CommandReply reply() {
        return CommandReply.builder()
                .channelId("channel-9")
                .title("Pong!")
                .field(ReplyField.of("Latency", "3ms"))
                .timestamp(TestFactory.START)
                .build();
    }

    @Test
    void testSuccessfulSendIsPublishedAndCounted() throws Exception {
        when(kafkaTemplate.send(anyString(), anyString(), anyString()))
                .thenReturn(CompletableFuture.completedFuture((SendResult<String, String>) null));

        sink.send(reply());

        ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
        verify(kafkaTemplate).send(eq("chat_replies"), eq("channel-9"), payload.capture());

        JsonNode json = objectMapper.readTree(payload.getValue());
        assertThat(json.get("channel_id").asText()).isEqualTo("channel-9");
        assertThat(json.get("title").asText()).isEqualTo("Pong!");
        assertThat(json.get("fields").get(0).get("name").asText()).isEqualTo("Latency");
        assertThat(json.get("timestamp").asText()).isEqualTo("2026-01-24T12:00:00Z");

        assertThat(metrics.externalRequestCounts().succeeded()).isEqualTo(1);
        assertThat(metrics.externalRequestCounts().failed()).isZero();
    }

    @Test
    void testBrokerFailureIsNetworkErrorAndCountedAsFailed() {
        when(kafkaTemplate.send(anyString(), anyString(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new KafkaException("broker down")));

        assertThatThrownBy(() -> sink.send(reply()))
                .isInstanceOf(RelayException.class)
                .hasMessageContaining("channel-9")
                .hasCauseInstanceOf(KafkaException.class)
                .extracting(e -> ((RelayException) e).getCategory())
                .isEqualTo(ErrorCategory.NETWORK);

        assertThat(metrics.externalRequestCounts().total()).isEqualTo(1);
        assertThat(metrics.externalRequestCounts().failed()).isEqualTo(1);
    }

    @Test
    void testTimeoutIsNetworkError() {
        when(kafkaTemplate.send(anyString(), anyString(), anyString()))
                .thenReturn(new CompletableFuture<>());

        assertThatThrownBy(() -> sink.send(reply()))
                .isInstanceOf(RelayException.class)
                .hasMessageContaining("Timed out after 200 ms");

        assertThat(metrics.externalRequestCounts().failed()).isEqualTo(1);
        assertThat(metrics.averageResponseTime()).isGreaterThanOrEqualTo(150.0);
    }

    @Test
    void testSynchronousSendFailureIsNetworkError() {
        when(kafkaTemplate.send(anyString(), anyString(), anyString()))
                .thenThrow(new KafkaException("metadata unavailable"));

        assertThatThrownBy(() -> sink.send(reply()))
                .isInstanceOf(RelayException.class)
                .extracting(e -> ((RelayException) e).getCategory())
                .isEqualTo(ErrorCategory.NETWORK);

        assertThat(metrics.externalRequestCounts().failed()).isEqualTo(1);
    }
}
