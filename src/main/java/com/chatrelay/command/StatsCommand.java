package com.chatrelay.command;

import com.chatrelay.dispatch.CommandHandler;
import com.chatrelay.dispatch.CommandInvocation;
import com.chatrelay.error.ErrorCategory;
import com.chatrelay.metrics.Metrics;
import com.chatrelay.metrics.MetricsSnapshot;
import com.chatrelay.model.CommandReply;
import com.chatrelay.model.ReplyField;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders the current {@link MetricsSnapshot} as a chat reply.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StatsCommand implements CommandHandler {

    private final Metrics metrics;

    @Override
    public String name() {
        return "stats";
    }

    @Override
    public String description() {
        return "Show bot performance statistics";
    }

    @Override
    public CommandReply handle(CommandInvocation invocation) {
        log.info("Showing bot statistics for user {}", invocation.message().getAuthorId());
        MetricsSnapshot snapshot = metrics.snapshot();

        CommandReply.CommandReplyBuilder reply = CommandReply.builder()
                .channelId(invocation.channelId())
                .title("Bot Statistics")
                .footer("Statistics since bot startup")
                .field(ReplyField.of("Commands", String.format(Locale.ROOT,
                        "Total: %d\nSuccessful: %d\nFailed: %d\nSuccess Rate: %.1f%%",
                        snapshot.commandsTotal(),
                        snapshot.commandsSuccessful(),
                        snapshot.commandsFailed(),
                        snapshot.commandSuccessRatePercent())))
                .field(ReplyField.of("API Requests", String.format(Locale.ROOT,
                        "Total: %d\nSuccess Rate: %.1f%%\nAvg Response: %.0fms",
                        snapshot.externalRequestsTotal(),
                        snapshot.externalSuccessRatePercent(),
                        snapshot.averageResponseTimeMillis())))
                .field(ReplyField.of("Performance", String.format(Locale.ROOT,
                        "Commands/sec: %.2f\nAPI Requests/sec: %.2f",
                        snapshot.commandsPerSecond(),
                        snapshot.externalRequestsPerSecond())))
                .field(ReplyField.of("Uptime",
                        formatUptime(Duration.ofMillis(Math.round(snapshot.uptimeSeconds() * 1000)))))
                .field(ReplyField.of("Started", snapshot.botStartTime()));

        String errors = formatErrors(snapshot.errorsByType());
        if (!errors.isEmpty()) {
            reply.field(ReplyField.fullWidth("Errors", errors));
        }
        return reply.build();
    }

    /**
     * Largest non-zero unit first: "2d 3h 4m 5s", "3h 4m 5s", "4m 5s" or "5s".
     */
    static String formatUptime(Duration uptime) {
        long totalSeconds = Math.max(0, uptime.getSeconds());
        long days = totalSeconds / 86_400;
        long hours = totalSeconds / 3_600 % 24;
        long minutes = totalSeconds / 60 % 60;
        long seconds = totalSeconds % 60;

        if (days > 0) {
            return String.format(Locale.ROOT, "%dd %dh %dm %ds", days, hours, minutes, seconds);
        }
        if (hours > 0) {
            return String.format(Locale.ROOT, "%dh %dm %ds", hours, minutes, seconds);
        }
        if (minutes > 0) {
            return String.format(Locale.ROOT, "%dm %ds", minutes, seconds);
        }
        return String.format(Locale.ROOT, "%ds", seconds);
    }

    private static String formatErrors(Map<ErrorCategory, Long> errorsByType) {
        List<String> lines = new ArrayList<>();
        for (ErrorCategory category : ErrorCategory.values()) {
            long count = errorsByType.getOrDefault(category, 0L);
            if (count > 0) {
                lines.add(category.label() + ": " + count);
            }
        }
        return String.join("\n", lines);
    }
}
