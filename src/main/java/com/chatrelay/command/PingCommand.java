package com.chatrelay.command;

import com.chatrelay.dispatch.CommandHandler;
import com.chatrelay.dispatch.CommandInvocation;
import com.chatrelay.model.CommandReply;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Slf4j
@Component
@RequiredArgsConstructor
public class PingCommand implements CommandHandler {

    private final Clock clock;

    @Override
    public String name() {
        return "ping";
    }

    @Override
    public String description() {
        return "Check if the bot is online and responding";
    }

    @Override
    public CommandReply handle(CommandInvocation invocation) {
        log.info("Handling ping command for user {}", invocation.message().getAuthorId());
        return CommandReply.builder()
                .channelId(invocation.channelId())
                .title("Pong!")
                .description("Bot is online and responding!")
                .timestamp(clock.instant())
                .build();
    }
}
