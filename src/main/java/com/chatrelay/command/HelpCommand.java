package com.chatrelay.command;

import com.chatrelay.dispatch.CommandHandler;
import com.chatrelay.dispatch.CommandInvocation;
import com.chatrelay.model.CommandReply;
import com.chatrelay.model.ReplyField;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Lists every registered command with its description.
 */
@Slf4j
@Component
public class HelpCommand implements CommandHandler {

    private final String botName;

    public HelpCommand(@Value("${relay.bot-name:ChatRelay}") String botName) {
        this.botName = botName;
    }

    @Override
    public String name() {
        return "help";
    }

    @Override
    public String description() {
        return "Show this help message";
    }

    @Override
    public CommandReply handle(CommandInvocation invocation) {
        log.info("Showing help information for user {}", invocation.message().getAuthorId());
        CommandReply.CommandReplyBuilder reply = CommandReply.builder()
                .channelId(invocation.channelId())
                .title(botName + " Help")
                .description("Commands understood by " + botName);
        for (CommandHandler command : invocation.commands()) {
            reply.field(ReplyField.fullWidth(invocation.prefix() + command.name(), command.description()));
        }
        return reply.build();
    }
}
