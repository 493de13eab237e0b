package com.chatrelay.lifecycle;

import com.chatrelay.dispatch.CommandDispatcher;
import com.chatrelay.dispatch.CommandHandler;
import com.chatrelay.metrics.Metrics;
import com.chatrelay.metrics.MetricsSnapshot;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Startup banner and the final metrics read at shutdown.
 */
@Slf4j
@Component
public class RelayLifecycle {

    private final CommandDispatcher dispatcher;
    private final Metrics metrics;
    private final String botName;

    public RelayLifecycle(
            CommandDispatcher dispatcher,
            Metrics metrics,
            @Value("${relay.bot-name:ChatRelay}") String botName
    ) {
        this.dispatcher = dispatcher;
        this.metrics = metrics;
        this.botName = botName;
    }

    @PostConstruct
    public void logUsage() {
        log.info("{} ready, command prefix '{}'", botName, dispatcher.getCommandPrefix());
        for (CommandHandler command : dispatcher.commands()) {
            log.info("  {}{} - {}", dispatcher.getCommandPrefix(), command.name(), command.description());
        }
    }

    @PreDestroy
    public void logFinalMetrics() {
        MetricsSnapshot snapshot = metrics.snapshot();
        log.info("Final metrics for {}: commands_total={}, api_requests_total={}, uptime_seconds={}",
                botName, snapshot.commandsTotal(), snapshot.externalRequestsTotal(), snapshot.uptimeSeconds());
    }
}
