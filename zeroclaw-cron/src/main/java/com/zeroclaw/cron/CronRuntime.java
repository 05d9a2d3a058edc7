package com.zeroclaw.cron;

import com.zeroclaw.common.config.ConfigService;
import com.zeroclaw.cron.CronState.CronEvent;
import com.zeroclaw.cron.delivery.CronDeliveryService;
import com.zeroclaw.cron.delivery.CronDeliveryTransport;
import com.zeroclaw.cron.exec.AgentJobExecutor;
import com.zeroclaw.cron.exec.AgentRunner;
import com.zeroclaw.cron.exec.CronJobExecutor;
import com.zeroclaw.cron.exec.CronJobExecutors;
import com.zeroclaw.cron.exec.ShellJobExecutor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Wires store, executors, delivery and dispatcher from configuration.
 *
 * <p>
 * The scheduler is skipped when {@code cron.enabled=false} or
 * {@code ZEROCLAW_SKIP_CRON=1}; the service stays usable for job management.
 */
@Slf4j
public class CronRuntime implements AutoCloseable {

    static final String SKIP_ENV = "ZEROCLAW_SKIP_CRON";

    private final CronService cronService;
    private final ShellJobExecutor shellExecutor;
    private final boolean cronEnabled;

    CronRuntime(CronService cronService, ShellJobExecutor shellExecutor, boolean cronEnabled) {
        this.cronService = cronService;
        this.shellExecutor = shellExecutor;
        this.cronEnabled = cronEnabled;
    }

    /**
     * @param agentRunner agent engine, or {@code null} when agent jobs are unsupported
     * @param listener    lifecycle event sink, may be {@code null}
     */
    public static CronRuntime create(ConfigService configService, AgentRunner agentRunner,
            List<CronDeliveryTransport> transports, Consumer<CronEvent> listener) {
        return create(configService, agentRunner, transports, listener, System::getenv, Clock.systemUTC());
    }

    static CronRuntime create(ConfigService configService, AgentRunner agentRunner,
            List<CronDeliveryTransport> transports, Consumer<CronEvent> listener,
            Function<String, String> env, Clock clock) {
        CronSettings settings = CronSettings.from(configService.loadConfig());
        boolean enabled = settings.isEnabled() && !"1".equals(env.apply(SKIP_ENV));

        CronStore store = new JsonCronStore(settings.getStorePath(), settings, clock);
        ShellJobExecutor shellExecutor = new ShellJobExecutor();
        List<CronJobExecutor> executors = new ArrayList<>();
        executors.add(shellExecutor);
        if (agentRunner != null) {
            executors.add(new AgentJobExecutor(agentRunner));
        }
        CronDispatcher dispatcher = new CronDispatcher(store, new CronJobExecutors(executors),
                new CronDeliveryService(transports), settings, clock);
        dispatcher.setListener(listener);

        return new CronRuntime(new CronService(store, dispatcher, settings.toBuilder().enabled(enabled).build()),
                shellExecutor, enabled);
    }

    /**
     * Start the dispatcher if enabled.
     */
    public void start() {
        if (!cronEnabled) {
            log.info("cron: disabled by config or {}", SKIP_ENV);
            return;
        }
        cronService.start();
        log.info("cron: started");
    }

    public void stop() {
        cronService.stop();
        log.info("cron: stopped");
    }

    @Override
    public void close() {
        // workers first, then the output readers they may still be draining
        cronService.close();
        shellExecutor.close();
    }

    public boolean isCronEnabled() {
        return cronEnabled;
    }

    public CronService getCronService() {
        return cronService;
    }

    ShellJobExecutor getShellExecutor() {
        return shellExecutor;
    }
}
