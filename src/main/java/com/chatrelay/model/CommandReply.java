package com.chatrelay.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Singular;

import java.time.Instant;
import java.util.List;

/**
 * Reply published back to the chat gateway for one channel.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommandReply {

    @JsonProperty("channel_id")
    private String channelId;

    @JsonProperty("title")
    private String title;

    @JsonProperty("description")
    private String description;

    @Singular
    @JsonProperty("fields")
    private List<ReplyField> fields;

    @JsonProperty("footer")
    private String footer;

    @JsonProperty("error")
    private boolean error;

    @JsonProperty("timestamp")
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant timestamp;

    public static CommandReply error(String channelId, String description) {
        return CommandReply.builder()
                .channelId(channelId)
                .title("Error")
                .description(description)
                .error(true)
                .build();
    }
}
