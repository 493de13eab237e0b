package com.chatrelay.dispatch;

import com.chatrelay.error.ErrorCategory;
import com.chatrelay.error.ErrorClassifier;
import com.chatrelay.error.RelayException;
import com.chatrelay.metrics.Metrics;
import com.chatrelay.model.ChatMessage;
import com.chatrelay.model.CommandReply;
import com.chatrelay.output.ReplySink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Routes prefixed chat messages to their {@link CommandHandler}.
 * <p>
 * Every executed command is counted as succeeded or failed. A failure is
 * classified, counted under its category and answered with a generic error
 * reply; it never propagates to the consumer.
 */
@Slf4j
@Component
public class CommandDispatcher {

    static final String GENERIC_FAILURE = "Sorry, something went wrong processing your command.";

    private final Map<String, CommandHandler> handlers;
    private final ReplySink replySink;
    private final Metrics metrics;
    private final String commandPrefix;

    public CommandDispatcher(
            List<CommandHandler> handlers,
            ReplySink replySink,
            Metrics metrics,
            @Value("${relay.command-prefix:!}") String commandPrefix
    ) {
        if (commandPrefix == null || commandPrefix.isBlank()) {
            throw RelayException.config("relay.command-prefix must not be blank");
        }
        this.handlers = indexByName(handlers);
        this.replySink = replySink;
        this.metrics = metrics;
        this.commandPrefix = commandPrefix;
        log.info("Initialized CommandDispatcher with prefix '{}' and commands {}", commandPrefix, this.handlers.keySet());
    }

    /**
     * Handle one chat message.
     *
     * - Ignore bots and messages without the prefix
     * - Look up the handler by lower-cased name
     * - Run it, send its reply, count the outcome
     */
    public DispatchOutcome dispatch(ChatMessage message) {
        if (message.isAuthorBot()) {
            return DispatchOutcome.IGNORED;
        }
        String content = message.getContent();
        if (content == null || !content.startsWith(commandPrefix)) {
            return DispatchOutcome.IGNORED;
        }

        String[] parts = content.substring(commandPrefix.length()).trim().split("\\s+");
        if (parts.length == 0 || parts[0].isEmpty()) {
            return DispatchOutcome.IGNORED;
        }

        String command = parts[0].toLowerCase(Locale.ROOT);
        List<String> args = List.of(Arrays.copyOfRange(parts, 1, parts.length));

        CommandHandler handler = handlers.get(command);
        if (handler == null) {
            log.warn("Unknown command '{}' from user {} in channel {}",
                    command, message.getAuthorId(), message.getChannelId());
            sendErrorReply(message.getChannelId(), String.format(
                    "Unknown command: %s%s. Use %shelp for available commands.",
                    commandPrefix, command, commandPrefix));
            return DispatchOutcome.UNKNOWN_COMMAND;
        }

        CommandInvocation invocation =
                new CommandInvocation(message, command, args, commandPrefix, commands());
        try {
            CommandReply reply = handler.handle(invocation);
            replySink.send(reply);
            metrics.recordCommand(true);
            log.debug("Command {} succeeded for user {} ({} commands/s)",
                    command, message.getAuthorId(), metrics.commandsPerSecond());
            return DispatchOutcome.SUCCEEDED;
        } catch (Exception e) {
            ErrorCategory category = ErrorClassifier.classify(e);
            log.error("Command execution failed (command={}, user={}, username={}, category={})",
                    command, message.getAuthorId(), message.getAuthorName(), category.label(), e);
            metrics.recordCommand(false);
            metrics.recordError(category);
            sendErrorReply(message.getChannelId(), GENERIC_FAILURE);
            return DispatchOutcome.FAILED;
        }
    }

    /**
     * Registered commands, ordered by name.
     */
    public Collection<CommandHandler> commands() {
        return Collections.unmodifiableCollection(handlers.values());
    }

    public String getCommandPrefix() {
        return commandPrefix;
    }

    private void sendErrorReply(String channelId, String description) {
        try {
            replySink.send(CommandReply.error(channelId, description));
        } catch (RuntimeException e) {
            log.error("Failed to send error message to channel {}", channelId, e);
        }
    }

    private static Map<String, CommandHandler> indexByName(List<CommandHandler> handlers) {
        Map<String, CommandHandler> byName = new TreeMap<>();
        for (CommandHandler handler : handlers) {
            String name = handler.name().toLowerCase(Locale.ROOT);
            CommandHandler previous = byName.putIfAbsent(name, handler);
            if (previous != null) {
                throw RelayException.config("Duplicate command name '" + name + "': "
                        + previous.getClass().getSimpleName() + " and " + handler.getClass().getSimpleName());
            }
        }
        return byName;
    }
}
