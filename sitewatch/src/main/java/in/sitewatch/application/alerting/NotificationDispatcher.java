package in.sitewatch.application.alerting;

import in.sitewatch.application.port.output.ChannelHandler;
import in.sitewatch.domain.alert.Alert;
import in.sitewatch.domain.channel.NotificationPayload;
import in.sitewatch.domain.rule.AlertRule;
import in.sitewatch.domain.rule.ChannelConfig;
import in.sitewatch.domain.rule.ChannelType;
import in.sitewatch.domain.rule.EscalationRule;
import in.sitewatch.domain.rule.RetryPolicy;
import in.sitewatch.infrastructure.metrics.AlertingMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.IntStream;

/**
 * Routes alerts to the channel handlers of every matching rule.
 *
 * Sends run on the dispatch executor, never on the caller's thread. A failed send
 * is retried on the same channel with the channel's backoff, spending the alert's
 * shared retry counter. Retries are owned by the {@link AlertTaskScheduler}.
 */
public final class NotificationDispatcher {
    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final AlertStore store;
    private final RuleRegistry rules;
    private final AlertTaskScheduler scheduler;
    private final Executor executor;
    private final AlertingMetrics metrics;
    private final Map<ChannelType, ChannelHandler> handlers = new ConcurrentHashMap<>();

    public NotificationDispatcher(AlertStore store, RuleRegistry rules, AlertTaskScheduler scheduler,
                                  Executor executor, AlertingMetrics metrics) {
        this.store = store;
        this.rules = rules;
        this.scheduler = scheduler;
        this.executor = executor;
        this.metrics = metrics;
    }

    /**
     * Register (or replace) the handler for a channel type.
     */
    public void registerChannel(ChannelType type, ChannelHandler handler) {
        ChannelHandler previous = handlers.put(type, handler);
        if (previous != null) {
            log.info("[DISPATCH] Replaced {} channel handler", type.wireName());
        } else {
            log.info("[DISPATCH] Registered {} channel handler", type.wireName());
        }
    }

    /**
     * Queue the initial notification for every enabled rule the alert matches.
     */
    public void dispatch(Alert alert) {
        submit(alert.getId(), () -> {
            List<AlertRule> matching = rules.findMatchingRules(alert);
            if (matching.isEmpty()) {
                log.debug("[DISPATCH] No rules match alert {}", alert.getId());
                return;
            }
            for (AlertRule rule : matching) {
                deliver(NotificationPayload.initial(alert, rule), rule.channels());
            }
        });
    }

    /**
     * Queue an escalation send for one rule's ladder step.
     */
    public void dispatchEscalation(Alert alert, AlertRule rule, EscalationRule step) {
        submit(alert.getId(), () ->
            deliver(NotificationPayload.escalation(alert, rule, step.level()), step.channels()));
    }

    private void submit(String alertId, Runnable work) {
        try {
            executor.execute(() -> {
                try {
                    work.run();
                } catch (Exception e) {
                    log.error("[DISPATCH] Dispatch for {} failed: {}", alertId, e.getMessage(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("[DISPATCH] Dispatch executor rejected alert {}, engine stopping", alertId);
        }
    }

    private void deliver(NotificationPayload payload, List<ChannelConfig> configs) {
        List<Integer> ordered = IntStream.range(0, configs.size())
            .filter(i -> configs.get(i).enabled())
            .boxed()
            .sorted(Comparator.comparingInt((Integer i) -> configs.get(i).priority()))
            .toList();
        for (int index : ordered) {
            send(payload, configs.get(index), index);
        }
    }

    private void send(NotificationPayload payload, ChannelConfig config, int channelIndex) {
        ChannelHandler handler = handlers.get(config.type());
        if (handler == null) {
            log.debug("[DISPATCH] No handler registered for {}, skipping", config.type().wireName());
            return;
        }

        Alert alert = payload.alert();
        try {
            handler.send(payload, config);
            metrics.recordDelivery(config.type(), true, payload.isEscalation());
            log.debug("[DISPATCH] Sent {} via {} (rule={}, escalation={})",
                alert.getId(), config.type().wireName(), payload.rule().id(), payload.isEscalation());
        } catch (RuntimeException e) {
            metrics.recordDelivery(config.type(), false, payload.isEscalation());
            log.warn("[DISPATCH] Failed to send {} via {}: {}",
                alert.getId(), config.type().wireName(), e.getMessage());
            scheduleRetry(payload, config, channelIndex);
        }
    }

    private void scheduleRetry(NotificationPayload payload, ChannelConfig config, int channelIndex) {
        String alertId = payload.alert().getId();
        Optional<Alert> current = store.getAlert(alertId);
        if (current.isEmpty() || current.get().getStatus().isTerminal()) {
            log.debug("[DISPATCH] Alert {} no longer open, not retrying", alertId);
            return;
        }

        RetryPolicy policy = config.retryPolicy();
        int retryCount = current.get().getRetryCount();
        if (!policy.shouldRetry(retryCount)) {
            metrics.recordDeliveryDropped(config.type());
            log.error("[DISPATCH] Giving up on {} via {} after {} retries",
                alertId, config.type().wireName(), retryCount);
            return;
        }

        Duration delay = policy.delayFor(retryCount);
        int level = payload.isEscalation() ? payload.escalationLevel() : 0;
        RetryKey key = new RetryKey(alertId, payload.rule().id(), level, channelIndex, config.type());
        boolean scheduled = scheduler.scheduleRetry(key,
            () -> submit(alertId, () -> retry(payload, config, channelIndex)), delay);
        if (scheduled) {
            metrics.recordRetryScheduled(config.type());
            log.info("[DISPATCH] Retry {} of {} via {} in {}ms",
                retryCount + 1, alertId, config.type().wireName(), delay.toMillis());
        }
    }

    private void retry(NotificationPayload original, ChannelConfig config, int channelIndex) {
        String alertId = original.alert().getId();
        Optional<Alert> alert = store.recordRetry(alertId);
        if (alert.isEmpty()) {
            log.debug("[DISPATCH] Dropping retry for {}, alert resolved or removed", alertId);
            return;
        }
        NotificationPayload payload = new NotificationPayload(
            alert.get(), original.rule(), original.isEscalation(), original.escalationLevel());
        send(payload, config, channelIndex);
    }
}
