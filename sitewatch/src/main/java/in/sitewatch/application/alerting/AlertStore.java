package in.sitewatch.application.alerting;

import in.sitewatch.domain.alert.Alert;
import in.sitewatch.domain.alert.AlertSeverity;
import in.sitewatch.domain.alert.AlertStatistics;
import in.sitewatch.domain.alert.AlertStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * In-memory keyed collection of alerts.
 *
 * Owns deduplication and every lifecycle transition. All access is serialized on
 * the store monitor; alerts are immutable so snapshots handed out stay consistent
 * while the store moves on.
 */
public final class AlertStore {
    private static final Logger log = LoggerFactory.getLogger(AlertStore.class);

    private static final Duration OVERFLOW_CLEANUP_AGE = Duration.ofHours(24);
    private static final String ID_ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";

    private final Map<String, Alert> alerts = new LinkedHashMap<>();
    private final Clock clock;
    private final int maxAlerts;
    private final boolean deduplicationEnabled;

    public AlertStore(Clock clock, int maxAlerts, boolean deduplicationEnabled) {
        if (maxAlerts <= 0) {
            throw new IllegalArgumentException("maxAlerts must be positive");
        }
        this.clock = clock;
        this.maxAlerts = maxAlerts;
        this.deduplicationEnabled = deduplicationEnabled;
    }

    /**
     * Outcome of {@link #admit}: the stored alert and whether it was newly inserted.
     */
    public record Admission(Alert alert, boolean created) {}

    /**
     * Insert a new alert, or collapse it into an identical ACTIVE, unsuppressed one.
     */
    public synchronized Admission admit(String title, String message, AlertSeverity severity, String source,
                                        Set<String> tags, Map<String, Object> metadata) {
        Instant now = clock.instant();

        if (deduplicationEnabled) {
            Alert existing = findSimilar(title, source, severity, now);
            if (existing != null) {
                Alert updated = existing.recordDuplicate(now);
                alerts.put(updated.getId(), updated);
                log.debug("[ALERT-STORE] Deduplicated '{}' from {} into {} (count={})",
                    title, source, updated.getId(), updated.getRetryCount());
                return new Admission(updated, false);
            }
        }

        if (alerts.size() > maxAlerts) {
            int removed = purgeResolvedBefore(now.minus(OVERFLOW_CLEANUP_AGE));
            log.info("[ALERT-STORE] Store above capacity ({}), removed {} old resolved alerts", maxAlerts, removed);
        }

        Alert alert = Alert.builder()
            .id(nextId(now))
            .title(title)
            .message(message)
            .severity(severity)
            .source(source)
            .tags(tags)
            .metadata(metadata)
            .createdAt(now)
            .updatedAt(now)
            .build();
        alerts.put(alert.getId(), alert);

        log.info("[ALERT-STORE] Created {} [{}] {} (source={})",
            alert.getId(), severity, title, source);
        return new Admission(alert, true);
    }

    private Alert findSimilar(String title, String source, AlertSeverity severity, Instant now) {
        for (Alert alert : alerts.values()) {
            if (alert.getTitle().equals(title)
                && alert.getSource().equals(source)
                && alert.getSeverity() == severity
                && alert.isActiveAt(now)) {
                return alert;
            }
        }
        return null;
    }

    /**
     * ACTIVE → ACKNOWLEDGED. False if missing or not ACTIVE.
     */
    public synchronized boolean acknowledge(String alertId, String actor) {
        Alert alert = alerts.get(alertId);
        if (alert == null || alert.getStatus() != AlertStatus.ACTIVE) {
            return false;
        }
        alerts.put(alertId, alert.acknowledge(actor, clock.instant()));
        log.info("[ALERT-STORE] {} acknowledged by {}", alertId, actor);
        return true;
    }

    /**
     * ACTIVE | ACKNOWLEDGED → RESOLVED. False if missing or already resolved.
     */
    public synchronized boolean resolve(String alertId, String actor) {
        Alert alert = alerts.get(alertId);
        if (alert == null || alert.getStatus().isTerminal()) {
            return false;
        }
        alerts.put(alertId, alert.resolve(actor, clock.instant()));
        log.info("[ALERT-STORE] {} resolved by {}", alertId, actor);
        return true;
    }

    /**
     * Hide a non-resolved alert from active views and escalation until now + duration.
     */
    public synchronized boolean suppress(String alertId, Duration duration) {
        Alert alert = alerts.get(alertId);
        if (alert == null || alert.getStatus().isTerminal()) {
            return false;
        }
        Instant now = clock.instant();
        alerts.put(alertId, alert.suppress(now.plus(duration), now));
        log.info("[ALERT-STORE] {} suppressed for {} minutes", alertId, duration.toMinutes());
        return true;
    }

    /**
     * Raise the escalation level of a stored alert; the level never decreases.
     */
    public Optional<Alert> escalate(String alertId, int level) {
        return update(alertId, alert -> alert.escalateTo(level, clock.instant()));
    }

    /**
     * Spend one unit of the alert's shared retry budget. Empty if the alert is gone or resolved.
     */
    public Optional<Alert> recordRetry(String alertId) {
        return update(alertId, alert -> alert.getStatus().isTerminal() ? null : alert.recordRetry(clock.instant()));
    }

    /**
     * Apply a change to a stored alert atomically. A change returning null leaves the
     * alert untouched and yields empty.
     */
    synchronized Optional<Alert> update(String alertId, UnaryOperator<Alert> change) {
        Alert alert = alerts.get(alertId);
        if (alert == null) {
            return Optional.empty();
        }
        Alert updated = change.apply(alert);
        if (updated == null) {
            return Optional.empty();
        }
        alerts.put(alertId, updated);
        return Optional.of(updated);
    }

    /**
     * Remove RESOLVED alerts resolved before the cutoff.
     *
     * @return number of alerts removed
     */
    public synchronized int purgeResolvedBefore(Instant cutoff) {
        int removed = 0;
        Iterator<Alert> it = alerts.values().iterator();
        while (it.hasNext()) {
            Alert alert = it.next();
            if (alert.getStatus() == AlertStatus.RESOLVED
                && alert.getResolvedAt() != null
                && alert.getResolvedAt().isBefore(cutoff)) {
                it.remove();
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("[ALERT-STORE] Purged {} resolved alerts older than {}", removed, cutoff);
        }
        return removed;
    }

    // ========================================================================
    // READS
    // ========================================================================

    public synchronized Optional<Alert> getAlert(String alertId) {
        return Optional.ofNullable(alerts.get(alertId));
    }

    public synchronized boolean contains(String alertId) {
        return alerts.containsKey(alertId);
    }

    public synchronized List<Alert> getAllAlerts() {
        return new ArrayList<>(alerts.values());
    }

    /**
     * ACTIVE alerts that are not currently suppressed.
     */
    public List<Alert> getActiveAlerts() {
        Instant now = clock.instant();
        return filter(alert -> alert.isActiveAt(now));
    }

    public List<Alert> getAlertsByStatus(AlertStatus status) {
        return filter(alert -> alert.getStatus() == status);
    }

    public List<Alert> getAlertsBySeverity(AlertSeverity severity) {
        return filter(alert -> alert.getSeverity() == severity);
    }

    public synchronized AlertStatistics getStatistics() {
        Instant now = clock.instant();
        int active = 0;
        int acknowledged = 0;
        int resolved = 0;
        int suppressed = 0;
        Map<AlertSeverity, Integer> bySeverity = new EnumMap<>(AlertSeverity.class);

        for (Alert alert : alerts.values()) {
            switch (alert.getStatus()) {
                case ACTIVE -> active++;
                case ACKNOWLEDGED -> acknowledged++;
                case RESOLVED -> resolved++;
            }
            if (alert.isSuppressedAt(now)) {
                suppressed++;
            }
            bySeverity.merge(alert.getSeverity(), 1, Integer::sum);
        }

        return new AlertStatistics(alerts.size(), active, acknowledged, resolved, suppressed, bySeverity);
    }

    public synchronized int size() {
        return alerts.size();
    }

    private synchronized List<Alert> filter(Predicate<Alert> predicate) {
        List<Alert> result = new ArrayList<>();
        for (Alert alert : alerts.values()) {
            if (predicate.test(alert)) {
                result.add(alert);
            }
        }
        return result;
    }

    private String nextId(Instant now) {
        String id;
        do {
            id = "alert_" + now.toEpochMilli() + "_" + randomSuffix();
        } while (alerts.containsKey(id));
        return id;
    }

    private static String randomSuffix() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder sb = new StringBuilder(9);
        for (int i = 0; i < 9; i++) {
            sb.append(ID_ALPHABET.charAt(random.nextInt(ID_ALPHABET.length())));
        }
        return sb.toString();
    }
}
