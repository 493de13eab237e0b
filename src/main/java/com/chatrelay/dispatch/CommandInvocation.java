package com.chatrelay.dispatch;

import com.chatrelay.model.ChatMessage;

import java.util.Collection;
import java.util.List;

/**
 * Everything a handler gets for one call: the triggering message, its arguments,
 * the active prefix and the registered commands in name order.
 */
public record CommandInvocation(
        ChatMessage message,
        String command,
        List<String> args,
        String prefix,
        Collection<CommandHandler> commands
) {

    public String channelId() {
        return message.getChannelId();
    }
}
