package in.sitewatch.domain.alert;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * A stored record of one detected abnormal condition and its lifecycle state.
 *
 * Instances are immutable. Every lifecycle change returns a new instance which the
 * alert store swaps in, so readers always see a consistent snapshot.
 */
public final class Alert {
    private final String id;
    private final String title;
    private final String message;
    private final AlertSeverity severity;
    private final AlertStatus status;
    private final String source;
    private final Set<String> tags;
    private final Map<String, Object> metadata;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final String acknowledgedBy;
    private final Instant acknowledgedAt;
    private final String resolvedBy;
    private final Instant resolvedAt;
    private final boolean suppressed;
    private final Instant suppressedUntil;
    private final int escalationLevel;
    private final int retryCount;

    private Alert(Builder builder) {
        this.id = builder.id;
        this.title = builder.title;
        this.message = builder.message;
        this.severity = builder.severity;
        this.status = builder.status;
        this.source = builder.source;
        this.tags = Collections.unmodifiableSet(new LinkedHashSet<>(builder.tags));
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : builder.createdAt;
        this.acknowledgedBy = builder.acknowledgedBy;
        this.acknowledgedAt = builder.acknowledgedAt;
        this.resolvedBy = builder.resolvedBy;
        this.resolvedAt = builder.resolvedAt;
        this.suppressed = builder.suppressed;
        this.suppressedUntil = builder.suppressedUntil;
        this.escalationLevel = builder.escalationLevel;
        this.retryCount = builder.retryCount;
    }

    public String getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public String getMessage() {
        return message;
    }

    public AlertSeverity getSeverity() {
        return severity;
    }

    public AlertStatus getStatus() {
        return status;
    }

    public String getSource() {
        return source;
    }

    public Set<String> getTags() {
        return tags;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public String getAcknowledgedBy() {
        return acknowledgedBy;
    }

    public Instant getAcknowledgedAt() {
        return acknowledgedAt;
    }

    public String getResolvedBy() {
        return resolvedBy;
    }

    public Instant getResolvedAt() {
        return resolvedAt;
    }

    /**
     * Raw suppression flag. It stays set after {@link #getSuppressedUntil()} passes;
     * use {@link #isSuppressedAt(Instant)} for the effective state.
     */
    public boolean isSuppressed() {
        return suppressed;
    }

    public Instant getSuppressedUntil() {
        return suppressedUntil;
    }

    public int getEscalationLevel() {
        return escalationLevel;
    }

    public int getRetryCount() {
        return retryCount;
    }

    /**
     * Suppression is time-boxed and evaluated lazily against the caller's clock.
     */
    public boolean isSuppressedAt(Instant now) {
        return suppressed && suppressedUntil != null && now.isBefore(suppressedUntil);
    }

    /**
     * ACTIVE and not currently suppressed.
     */
    public boolean isActiveAt(Instant now) {
        return status == AlertStatus.ACTIVE && !isSuppressedAt(now);
    }

    // ========================================================================
    // LIFECYCLE TRANSITIONS
    // ========================================================================

    public Alert acknowledge(String actor, Instant at) {
        requireTransition(AlertStatus.ACKNOWLEDGED);
        return toBuilder()
            .status(AlertStatus.ACKNOWLEDGED)
            .acknowledgedBy(actor)
            .acknowledgedAt(at)
            .updatedAt(at)
            .build();
    }

    public Alert resolve(String actor, Instant at) {
        requireTransition(AlertStatus.RESOLVED);
        return toBuilder()
            .status(AlertStatus.RESOLVED)
            .resolvedBy(actor)
            .resolvedAt(at)
            .updatedAt(at)
            .build();
    }

    public Alert suppress(Instant until, Instant at) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Cannot suppress resolved alert " + id);
        }
        return toBuilder()
            .suppressed(true)
            .suppressedUntil(until)
            .updatedAt(at)
            .build();
    }

    /**
     * A repeated identical signal collapsed into this alert.
     */
    public Alert recordDuplicate(Instant at) {
        return toBuilder()
            .retryCount(retryCount + 1)
            .updatedAt(at)
            .build();
    }

    /**
     * A notification retry is about to be attempted.
     */
    public Alert recordRetry(Instant at) {
        return toBuilder()
            .retryCount(retryCount + 1)
            .updatedAt(at)
            .build();
    }

    /**
     * Raise the escalation level. Never lowers it.
     */
    public Alert escalateTo(int level, Instant at) {
        if (level <= escalationLevel) {
            return this;
        }
        return toBuilder()
            .escalationLevel(level)
            .updatedAt(at)
            .build();
    }

    private void requireTransition(AlertStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException(
                String.format("Alert %s cannot move from %s to %s", id, status, target));
        }
    }

    public Builder toBuilder() {
        return new Builder()
            .id(id)
            .title(title)
            .message(message)
            .severity(severity)
            .status(status)
            .source(source)
            .tags(tags)
            .metadata(metadata)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .acknowledgedBy(acknowledgedBy)
            .acknowledgedAt(acknowledgedAt)
            .resolvedBy(resolvedBy)
            .resolvedAt(resolvedAt)
            .suppressed(suppressed)
            .suppressedUntil(suppressedUntil)
            .escalationLevel(escalationLevel)
            .retryCount(retryCount);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String title;
        private String message = "";
        private AlertSeverity severity;
        private AlertStatus status = AlertStatus.ACTIVE;
        private String source;
        private Set<String> tags = new LinkedHashSet<>();
        private Map<String, Object> metadata = new LinkedHashMap<>();
        private Instant createdAt = Instant.now();
        private Instant updatedAt;
        private String acknowledgedBy;
        private Instant acknowledgedAt;
        private String resolvedBy;
        private Instant resolvedAt;
        private boolean suppressed;
        private Instant suppressedUntil;
        private int escalationLevel;
        private int retryCount;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder message(String message) {
            this.message = message != null ? message : "";
            return this;
        }

        public Builder severity(AlertSeverity severity) {
            this.severity = severity;
            return this;
        }

        public Builder status(AlertStatus status) {
            this.status = status;
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder tag(String tag) {
            this.tags.add(tag);
            return this;
        }

        public Builder tags(Iterable<String> tags) {
            this.tags = new LinkedHashSet<>();
            if (tags != null) {
                tags.forEach(this.tags::add);
            }
            return this;
        }

        public Builder metadata(String key, Object value) {
            this.metadata.put(key, value);
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = new LinkedHashMap<>();
            if (metadata != null) {
                this.metadata.putAll(metadata);
            }
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder acknowledgedBy(String acknowledgedBy) {
            this.acknowledgedBy = acknowledgedBy;
            return this;
        }

        public Builder acknowledgedAt(Instant acknowledgedAt) {
            this.acknowledgedAt = acknowledgedAt;
            return this;
        }

        public Builder resolvedBy(String resolvedBy) {
            this.resolvedBy = resolvedBy;
            return this;
        }

        public Builder resolvedAt(Instant resolvedAt) {
            this.resolvedAt = resolvedAt;
            return this;
        }

        public Builder suppressed(boolean suppressed) {
            this.suppressed = suppressed;
            return this;
        }

        public Builder suppressedUntil(Instant suppressedUntil) {
            this.suppressedUntil = suppressedUntil;
            return this;
        }

        public Builder escalationLevel(int escalationLevel) {
            this.escalationLevel = escalationLevel;
            return this;
        }

        public Builder retryCount(int retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        public Alert build() {
            if (id == null || title == null || severity == null || source == null) {
                throw new IllegalStateException("id, title, severity, and source are required");
            }
            if (escalationLevel < 0 || retryCount < 0) {
                throw new IllegalStateException("escalationLevel and retryCount must be non-negative");
            }
            return new Alert(this);
        }
    }

    @Override
    public String toString() {
        return String.format("[%s] %s: %s (%s, %s, L%d)",
            severity, title, message, id, status, escalationLevel);
    }
}
