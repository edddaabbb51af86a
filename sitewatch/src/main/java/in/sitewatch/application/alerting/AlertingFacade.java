package in.sitewatch.application.alerting;

import in.sitewatch.application.port.output.AlertArchive;
import in.sitewatch.application.port.output.ChannelHandler;
import in.sitewatch.application.port.output.EmailTransport;
import in.sitewatch.application.port.output.MetricsSource;
import in.sitewatch.application.port.output.SmsGateway;
import in.sitewatch.config.AlertingConfig;
import in.sitewatch.domain.alert.Alert;
import in.sitewatch.domain.alert.AlertSeverity;
import in.sitewatch.domain.alert.AlertStatistics;
import in.sitewatch.domain.alert.AlertStatus;
import in.sitewatch.domain.rule.AlertRule;
import in.sitewatch.domain.rule.ChannelType;
import in.sitewatch.infrastructure.channel.ChatChannelHandler;
import in.sitewatch.infrastructure.channel.ConsoleChannelHandler;
import in.sitewatch.infrastructure.channel.DatabaseChannelHandler;
import in.sitewatch.infrastructure.channel.EmailChannelHandler;
import in.sitewatch.infrastructure.channel.JsonHttpPoster;
import in.sitewatch.infrastructure.channel.LoggingAlertArchive;
import in.sitewatch.infrastructure.channel.LoggingEmailTransport;
import in.sitewatch.infrastructure.channel.LoggingSmsGateway;
import in.sitewatch.infrastructure.channel.SmsChannelHandler;
import in.sitewatch.infrastructure.channel.WebhookChannelHandler;
import in.sitewatch.infrastructure.metrics.AlertingMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Public surface of the alerting engine.
 *
 * Owns the alert store, rule registry, dispatcher and the two periodic passes
 * (rule evaluation and escalation). Create with {@link #builder()}, then
 * {@link #start()}; {@link #stop()} cancels timers and pending retries and is final.
 */
public final class AlertingFacade {
    private static final Logger log = LoggerFactory.getLogger(AlertingFacade.class);

    private final AlertingConfig config;
    private final AlertStore store;
    private final RuleRegistry rules;
    private final AlertTaskScheduler scheduler;
    private final NotificationDispatcher dispatcher;
    private final EscalationScheduler escalations;
    private final ConditionEvaluator evaluator;
    private final AlertingMetrics metrics;
    private final ExecutorService ownedExecutor;

    private boolean running = false;
    private boolean stopped = false;

    private AlertingFacade(Builder builder) {
        this.config = builder.config;
        this.metrics = builder.metrics;
        this.store = new AlertStore(builder.clock, config.maxAlerts(), config.enableDeduplication());
        this.rules = new RuleRegistry();
        this.scheduler = new AlertTaskScheduler();

        Executor executor = builder.executor;
        if (executor == null) {
            AtomicInteger counter = new AtomicInteger();
            this.ownedExecutor = Executors.newFixedThreadPool(4, r -> {
                Thread t = new Thread(r, "alerting-dispatch-" + counter.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
            executor = ownedExecutor;
        } else {
            this.ownedExecutor = null;
        }

        this.dispatcher = new NotificationDispatcher(store, rules, scheduler, executor, metrics);
        this.escalations = new EscalationScheduler(store, rules, dispatcher, builder.clock, metrics, config.retention());
        this.evaluator = new ConditionEvaluator(rules, builder.metricsSource, this::createAlert, builder.clock, metrics,
            config.evaluationInterval());

        if (builder.registerDefaultChannels) {
            JsonHttpPoster poster = new JsonHttpPoster();
            dispatcher.registerChannel(ChannelType.CONSOLE, new ConsoleChannelHandler(builder.consoleStream));
            dispatcher.registerChannel(ChannelType.WEBHOOK, new WebhookChannelHandler(poster, builder.clock));
            dispatcher.registerChannel(ChannelType.CHAT, new ChatChannelHandler(poster));
            dispatcher.registerChannel(ChannelType.EMAIL, new EmailChannelHandler(builder.emailTransport));
            dispatcher.registerChannel(ChannelType.SMS, new SmsChannelHandler(builder.smsGateway));
            dispatcher.registerChannel(ChannelType.DATABASE, new DatabaseChannelHandler(builder.alertArchive));
        }
        builder.handlers.forEach(dispatcher::registerChannel);
    }

    // ========================================================================
    // LIFECYCLE
    // ========================================================================

    /**
     * Start the evaluation and escalation timers. Calling again while running is a no-op.
     *
     * @throws IllegalStateException if the engine has been stopped
     */
    public synchronized void start() {
        if (running) {
            return;
        }
        if (stopped) {
            throw new IllegalStateException("Alerting engine cannot be restarted after stop()");
        }
        running = true;

        if (!config.enabled()) {
            log.info("[ALERTING] Alerting disabled, timers not started");
            return;
        }

        scheduler.scheduleAtFixedRate("rule-evaluation", evaluator::evaluateRules, config.evaluationInterval());
        if (config.enableEscalation()) {
            scheduler.scheduleAtFixedRate("escalation", escalations::processEscalations, config.escalationInterval());
        } else {
            scheduler.scheduleAtFixedRate("retention", escalations::purgeExpired, config.escalationInterval());
        }

        log.info("[ALERTING] Alerting engine started ({} rules, escalation={}, dedup={})",
            rules.size(), config.enableEscalation(), config.enableDeduplication());
    }

    /**
     * Cancel timers and every pending retry, then shut down the dispatch pool.
     */
    public synchronized void stop() {
        if (stopped) {
            return;
        }
        stopped = true;
        running = false;

        scheduler.shutdown();
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
            try {
                if (!ownedExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    ownedExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                ownedExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("[ALERTING] Alerting engine stopped");
    }

    public synchronized boolean isRunning() {
        return running;
    }

    // ========================================================================
    // ALERT LIFECYCLE
    // ========================================================================

    public String createAlert(String title, String message, AlertSeverity severity, String source) {
        return createAlert(title, message, severity, source, Set.of(), Map.of());
    }

    /**
     * Store an alert and queue its notifications. An identical open alert (same title,
     * source and severity) absorbs the signal instead and nothing is sent.
     *
     * @return id of the new or absorbing alert
     * @throws AlertValidationException if title, severity or source is missing
     */
    public String createAlert(String title, String message, AlertSeverity severity, String source,
                              Set<String> tags, Map<String, Object> metadata) {
        if (title == null || title.isBlank()) {
            throw new AlertValidationException("title", "is required");
        }
        if (severity == null) {
            throw new AlertValidationException("severity", "is required");
        }
        if (source == null || source.isBlank()) {
            throw new AlertValidationException("source", "is required");
        }

        AlertStore.Admission admission = store.admit(title, message, severity, source, tags, metadata);
        if (admission.created()) {
            metrics.recordAlertCreated(severity);
            dispatcher.dispatch(admission.alert());
        } else {
            metrics.recordAlertDeduplicated(severity);
        }
        return admission.alert().getId();
    }

    public boolean acknowledgeAlert(String alertId, String actor) {
        return store.acknowledge(alertId, actor);
    }

    /**
     * Resolve an alert and cancel its pending retries.
     */
    public boolean resolveAlert(String alertId, String actor) {
        if (!store.resolve(alertId, actor)) {
            return false;
        }
        int cancelled = scheduler.cancelRetries(alertId);
        if (cancelled > 0) {
            log.debug("[ALERTING] Cancelled {} pending retries for {}", cancelled, alertId);
        }
        return true;
    }

    public boolean suppressAlert(String alertId, int durationMinutes) {
        if (durationMinutes <= 0) {
            throw new AlertValidationException("duration", "must be positive");
        }
        return store.suppress(alertId, Duration.ofMinutes(durationMinutes));
    }

    /**
     * Suppress for the configured default duration.
     */
    public boolean suppressAlert(String alertId) {
        return suppressAlert(alertId, config.defaultSuppressionMinutes());
    }

    // ========================================================================
    // RULES AND CHANNELS
    // ========================================================================

    public void registerChannel(ChannelType type, ChannelHandler handler) {
        dispatcher.registerChannel(type, handler);
    }

    public void addRule(AlertRule rule) {
        rules.addRule(rule);
    }

    public boolean removeRule(String ruleId) {
        return rules.removeRule(ruleId);
    }

    public boolean updateRule(AlertRule rule) {
        return rules.updateRule(rule);
    }

    public Optional<AlertRule> getRule(String ruleId) {
        return rules.getRule(ruleId);
    }

    public List<AlertRule> getRules() {
        return rules.getRules();
    }

    // ========================================================================
    // QUERIES
    // ========================================================================

    public Optional<Alert> getAlert(String alertId) {
        return store.getAlert(alertId);
    }

    public List<Alert> getAllAlerts() {
        return store.getAllAlerts();
    }

    public List<Alert> getActiveAlerts() {
        return store.getActiveAlerts();
    }

    public List<Alert> getAlertsByStatus(AlertStatus status) {
        return store.getAlertsByStatus(status);
    }

    public List<Alert> getAlertsBySeverity(AlertSeverity severity) {
        return store.getAlertsBySeverity(severity);
    }

    public AlertStatistics getAlertStatistics() {
        return store.getStatistics();
    }

    public AlertingConfig getConfig() {
        return config;
    }

    // ========================================================================
    // MANUAL TRIGGERS
    // ========================================================================

    /**
     * Run one rule-evaluation pass on the caller's thread.
     */
    public int evaluateRulesNow() {
        return evaluator.evaluateRules();
    }

    /**
     * Run one escalation pass on the caller's thread.
     */
    public int processEscalationsNow() {
        return escalations.processEscalations();
    }

    public int pendingRetryCount() {
        return scheduler.pendingRetryCount();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private AlertingConfig config = AlertingConfig.defaults();
        private Clock clock = Clock.systemUTC();
        private MetricsSource metricsSource = (metric, window) -> null;
        private Executor executor;
        private AlertingMetrics metrics = AlertingMetrics.noop();
        private PrintStream consoleStream = System.out;
        private EmailTransport emailTransport = new LoggingEmailTransport();
        private SmsGateway smsGateway = new LoggingSmsGateway();
        private AlertArchive alertArchive = new LoggingAlertArchive();
        private boolean registerDefaultChannels = true;
        private final Map<ChannelType, ChannelHandler> handlers = new EnumMap<>(ChannelType.class);

        public Builder config(AlertingConfig config) {
            this.config = config;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder metricsSource(MetricsSource metricsSource) {
            this.metricsSource = metricsSource;
            return this;
        }

        /**
         * Executor for notification sends. When unset the facade owns a daemon pool.
         */
        public Builder executor(Executor executor) {
            this.executor = executor;
            return this;
        }

        public Builder metrics(AlertingMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder consoleStream(PrintStream consoleStream) {
            this.consoleStream = consoleStream;
            return this;
        }

        public Builder emailTransport(EmailTransport emailTransport) {
            this.emailTransport = emailTransport;
            return this;
        }

        public Builder smsGateway(SmsGateway smsGateway) {
            this.smsGateway = smsGateway;
            return this;
        }

        public Builder alertArchive(AlertArchive alertArchive) {
            this.alertArchive = alertArchive;
            return this;
        }

        /**
         * Skip the built-in console, webhook, chat, email, SMS and database handlers.
         */
        public Builder withoutDefaultChannels() {
            this.registerDefaultChannels = false;
            return this;
        }

        /**
         * Register a handler, replacing the built-in one for that type.
         */
        public Builder channel(ChannelType type, ChannelHandler handler) {
            this.handlers.put(type, handler);
            return this;
        }

        public AlertingFacade build() {
            if (config == null || clock == null || metricsSource == null || metrics == null) {
                throw new IllegalStateException("config, clock, metricsSource, and metrics are required");
            }
            return new AlertingFacade(this);
        }
    }
}
