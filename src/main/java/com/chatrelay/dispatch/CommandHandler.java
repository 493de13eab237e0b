package com.chatrelay.dispatch;

import com.chatrelay.model.CommandReply;

/**
 * A chat command. Implementations are Spring beans, picked up by {@link CommandDispatcher}.
 */
public interface CommandHandler {

    /**
     * Lower-case name the command is invoked by, without prefix.
     */
    String name();

    /**
     * One line shown by the help command.
     */
    String description();

    /**
     * Execute the command and build its reply. Throwing marks the command as failed.
     */
    CommandReply handle(CommandInvocation invocation);
}
