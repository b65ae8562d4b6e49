package com.watchdog.agent;

import com.watchdog.agent.probe.CommandRunner;
import com.watchdog.agent.probe.DockerChecker;
import com.watchdog.agent.probe.HttpChecker;
import com.watchdog.agent.probe.Pm2Checker;
import com.watchdog.agent.probe.ProcessCommandRunner;
import com.watchdog.agent.probe.ResourceChecker;
import com.watchdog.agent.probe.SystemResourceSampler;
import com.watchdog.agent.probe.SystemdChecker;
import com.watchdog.agent.probe.TlsChecker;
import com.watchdog.agent.telegram.TelegramCommandPoller;
import com.watchdog.agent.telegram.TelegramNotifier;
import com.watchdog.core.check.CheckerRegistry;
import com.watchdog.core.config.ConfigLoader;
import com.watchdog.core.config.WatchdogConfig;
import com.watchdog.core.detection.AnomalyDetector;
import com.watchdog.core.model.MonitoredTarget;
import com.watchdog.core.monitor.CheckResultHandler;
import com.watchdog.core.monitor.CommandHandler;
import com.watchdog.core.monitor.MonitorScheduler;
import com.watchdog.core.notify.MessageFormatter;
import com.watchdog.core.notify.NotificationDispatcher;
import com.watchdog.core.notify.Notifier;
import com.watchdog.core.state.StateEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;

/**
 * Main entry point for the Watchdog agent.
 *
 * <h3>Wiring</h3>
 *
 * <pre>
 *   MonitorScheduler (per-category timers)
 *     → Checker per target type (docker, pm2, systemd, http, ssl, resource)
 *     → CheckResultHandler (StateEngine + AnomalyDetector)
 *     → MessageFormatter
 *     → NotificationDispatcher → Telegram (or the log)
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Monitored services come from {@code watchdog.yml} via {@link ConfigLoader};
 * deployment settings come from environment variables via
 * {@link AgentConfig}.
 * </p>
 *
 * <h3>Shutdown</h3>
 * <p>
 * A JVM shutdown hook stops the timers, persists state, announces the
 * shutdown and drains the notification queue before exit.
 * </p>
 *
 * @since 1.0.0
 */
public final class WatchdogApplication {

    private static final Logger LOG = LoggerFactory.getLogger(WatchdogApplication.class);

    private WatchdogApplication() {
    }

    public static void main(String[] args) throws InterruptedException {
        // 1. Load configuration
        WatchdogConfig config = ConfigLoader.load();
        AgentConfig agent = AgentConfig.fromEnvironment();
        LOG.info("Starting Watchdog with {}", agent);

        // 2. State and detection
        Clock clock = Clock.systemUTC();
        StateEngine state = new StateEngine(agent.getStatePath(), config.getAlerts(), clock);
        AnomalyDetector anomalyDetector = new AnomalyDetector(config.getAnomaly());

        // 3. Notifications
        TelegramNotifier telegram = agent.telegramEnabled()
                ? new TelegramNotifier(agent.getTelegramApiUrl(), agent.getTelegramToken(), agent.getTelegramChatId())
                : null;
        Notifier notifier = telegram != null ? telegram : new LogNotifier();
        if (telegram == null) {
            LOG.warn("TELEGRAM_BOT_TOKEN not set, notifications will only be logged");
        }
        NotificationDispatcher dispatcher = new NotificationDispatcher(notifier, config.getAlerts().minSendInterval());
        dispatcher.start();
        MessageFormatter formatter = new MessageFormatter(config.getAlerts().flappingWindow());

        // 4. Monitor
        CheckResultHandler handler = new CheckResultHandler(state, anomalyDetector, dispatcher, formatter,
                config.getAlerts(), clock);
        MonitorScheduler scheduler = MonitorScheduler.builder()
                .checkers(buildCheckers(config))
                .handler(handler)
                .state(state)
                .anomalyDetector(anomalyDetector)
                .intervals(config.getIntervals())
                .targets(config.targets())
                .anomalyPath(agent.getAnomalyPath())
                .workerThreads(agent.getWorkerThreads())
                .build();

        // 5. Status server and chat commands
        StatusServer statusServer = new StatusServer(scheduler, state);
        String dashboardUrl = null;
        if (agent.isStatusEnabled()) {
            statusServer.start(agent.getStatusPort());
            if (statusServer.isRunning()) {
                dashboardUrl = "http://localhost:" + statusServer.getPort();
            }
        }
        TelegramCommandPoller poller = telegram != null
                ? new TelegramCommandPoller(telegram, new CommandHandler(state, clock), dispatcher,
                        Duration.ofSeconds(agent.getCommandPollSeconds()))
                : null;

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutting down Watchdog");
            if (poller != null) {
                poller.close();
            }
            scheduler.shutdown();
            dispatcher.enqueue(formatter.formatShutdown());
            dispatcher.close();
            statusServer.stop();
            stopped.countDown();
        }, "watchdog-shutdown"));

        // 6. Go
        dispatcher.enqueue(formatter.formatStartup(config, dashboardUrl));
        scheduler.start();
        if (poller != null) {
            poller.start();
        }
        LOG.info("Watchdog running: {} target(s)", config.targets().size());
        stopped.await();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    static CheckerRegistry buildCheckers(WatchdogConfig config) {
        CommandRunner runner = new ProcessCommandRunner(config.getProbes().commandTimeout());
        return CheckerRegistry.builder()
                .register(DockerChecker.TYPE, new DockerChecker(runner))
                .register(Pm2Checker.TYPE, new Pm2Checker(runner))
                .register(SystemdChecker.TYPE, new SystemdChecker(runner))
                .register(MonitoredTarget.TYPE_HTTP, new HttpChecker(config.getProbes()))
                .register(MonitoredTarget.TYPE_SSL, new TlsChecker(config.getThresholds(), config.getProbes()))
                .register(ResourceChecker.TYPE,
                        new ResourceChecker(new SystemResourceSampler(), config.getThresholds()))
                .build();
    }
}
