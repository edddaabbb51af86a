package in.sitewatch.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.sitewatch.domain.alert.AlertSeverity;
import in.sitewatch.domain.channel.ChannelSettings;
import in.sitewatch.domain.rule.AlertCondition;
import in.sitewatch.domain.rule.AlertRule;
import in.sitewatch.domain.rule.ChannelConfig;
import in.sitewatch.domain.rule.ChannelType;
import in.sitewatch.domain.rule.ConditionOperator;
import in.sitewatch.domain.rule.EscalationGate;
import in.sitewatch.domain.rule.EscalationRule;
import in.sitewatch.domain.rule.RetryPolicy;
import in.sitewatch.domain.rule.RuleValidationException;
import in.sitewatch.util.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads alert rules from a JSON array.
 *
 * Durations are minutes. String values may reference {@code ${ENV_NAME}}; a webhook
 * or chat channel whose URL is missing or unresolved is loaded disabled.
 *
 * <pre>
 * [{
 *   "id": "critical-errors", "name": "Critical System Errors", "severity": "critical",
 *   "condition": {"metric": "error.count", "operator": "gte", "threshold": 5,
 *                 "timeWindow": 5, "evaluationInterval": 1, "consecutiveFailures": 1},
 *   "channels": [{"type": "slack", "config": {"webhook": "${SLACK_WEBHOOK_URL}"},
 *                 "retryPolicy": {"maxRetries": 3, "retryDelay": 2, "backoffMultiplier": 1.5}}],
 *   "tags": ["critical"], "suppressDuration": 30,
 *   "escalationRules": [{"level": 1, "delay": 15, "condition": "unacknowledged", "channels": [...]}]
 * }]
 * </pre>
 */
public final class RuleDefinitionLoader {
    private static final Logger log = LoggerFactory.getLogger(RuleDefinitionLoader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String DEFAULT_RESOURCE = "default-alert-rules.json";

    public List<AlertRule> load(InputStream in) throws IOException {
        return parse(MAPPER.readTree(in));
    }

    public List<AlertRule> loadFile(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            List<AlertRule> rules = load(in);
            log.info("[RULES] Loaded {} rules from {}", rules.size(), path);
            return rules;
        }
    }

    public List<AlertRule> loadResource(String name) throws IOException {
        try (InputStream in = RuleDefinitionLoader.class.getClassLoader().getResourceAsStream(name)) {
            if (in == null) {
                throw new IOException("Rule resource not found on classpath: " + name);
            }
            List<AlertRule> rules = load(in);
            log.info("[RULES] Loaded {} rules from classpath:{}", rules.size(), name);
            return rules;
        }
    }

    /**
     * @throws RuleValidationException if any rule is malformed
     */
    List<AlertRule> parse(JsonNode root) {
        if (root == null || !root.isArray()) {
            throw new RuleValidationException("<file>", "Rule definitions must be a JSON array");
        }
        List<AlertRule> rules = new ArrayList<>();
        for (JsonNode node : root) {
            AlertRule rule = parseRule(node);
            rule.validate();
            rules.add(rule);
        }
        return rules;
    }

    private AlertRule parseRule(JsonNode node) {
        String ruleId = node.path("id").asText(null);
        String where = ruleId != null ? ruleId : "<missing>";
        try {
            AlertRule.Builder rule = AlertRule.builder()
                .id(ruleId)
                .name(node.path("name").asText(null))
                .description(node.path("description").asText(""))
                .severity(node.hasNonNull("severity") ? AlertSeverity.fromWire(node.get("severity").asText()) : null)
                .condition(node.hasNonNull("condition") ? parseCondition(node.get("condition")) : null)
                .channels(parseChannels(where, node.path("channels")))
                .enabled(node.path("enabled").asBoolean(true))
                .tags(parseStrings(node.path("tags")))
                .suppressDurationMinutes(node.path("suppressDuration").asInt(0));

            for (JsonNode step : node.path("escalationRules")) {
                rule.escalation(new EscalationRule(
                    step.path("level").asInt(),
                    step.path("delay").asInt(),
                    parseChannels(where, step.path("channels")),
                    EscalationGate.fromWire(step.path("condition").asText(null))));
            }

            if (node.hasNonNull("metadata")) {
                rule.metadata(MAPPER.convertValue(node.get("metadata"), new TypeReference<Map<String, Object>>() {}));
            }
            return rule.build();
        } catch (IllegalArgumentException e) {
            throw new RuleValidationException(where, e.getMessage(), e);
        }
    }

    private static AlertCondition parseCondition(JsonNode node) {
        JsonNode threshold = node.path("threshold");
        return new AlertCondition(
            node.path("metric").asText(null),
            ConditionOperator.fromWire(node.path("operator").asText(null)),
            threshold.isNumber() ? threshold.numberValue() : threshold.asText(null),
            node.path("timeWindow").asInt(5),
            node.path("evaluationInterval").asInt(1),
            node.path("consecutiveFailures").asInt(1));
    }

    private static List<ChannelConfig> parseChannels(String ruleId, JsonNode array) {
        List<ChannelConfig> channels = new ArrayList<>();
        for (JsonNode node : array) {
            channels.add(parseChannel(ruleId, node));
        }
        return channels;
    }

    private static ChannelConfig parseChannel(String ruleId, JsonNode node) {
        ChannelType type = ChannelType.fromWire(node.path("type").asText(null));
        JsonNode config = node.path("config");
        ChannelSettings settings = switch (type) {
            case CONSOLE -> ChannelSettings.Console.INSTANCE;
            case WEBHOOK -> new ChannelSettings.Webhook(
                resolved(config, "url"),
                parseHeaders(config.path("headers")),
                config.hasNonNull("template") ? templateText(config.get("template")) : null);
            case EMAIL -> new ChannelSettings.Email(parseList(config.path("recipients")), resolved(config, "subject"));
            case CHAT -> new ChannelSettings.Chat(
                config.hasNonNull("webhook") ? resolved(config, "webhook") : resolved(config, "webhookUrl"),
                resolved(config, "channel"));
            case SMS -> new ChannelSettings.Sms(parseList(config.path("numbers")));
            case DATABASE -> new ChannelSettings.Database(resolved(config, "table"));
        };

        ChannelConfig channel = new ChannelConfig(
            type,
            node.path("enabled").asBoolean(true),
            settings,
            node.path("priority").asInt(1),
            parseRetryPolicy(node.path("retryPolicy")));

        if (channel.enabled() && isMissingUrl(settings)) {
            log.warn("[RULES] Rule {}: {} channel has no URL configured, loading it disabled",
                ruleId, type.wireName());
            return channel.disabled();
        }
        return channel;
    }

    private static boolean isMissingUrl(ChannelSettings settings) {
        if (settings instanceof ChannelSettings.Webhook) {
            String url = ((ChannelSettings.Webhook) settings).url();
            return url == null || url.isBlank();
        }
        if (settings instanceof ChannelSettings.Chat) {
            String url = ((ChannelSettings.Chat) settings).webhookUrl();
            return url == null || url.isBlank();
        }
        return false;
    }

    private static RetryPolicy parseRetryPolicy(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return RetryPolicy.defaults();
        }
        RetryPolicy d = RetryPolicy.defaults();
        return new RetryPolicy(
            node.path("maxRetries").asInt(d.maxRetries()),
            node.path("retryDelay").asDouble(d.retryDelayMinutes()),
            node.path("backoffMultiplier").asDouble(d.backoffMultiplier()));
    }

    private static String templateText(JsonNode template) {
        return template.isTextual() ? template.asText() : template.toString();
    }

    private static String resolved(JsonNode config, String field) {
        JsonNode value = config.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return Env.resolvePlaceholders(value.asText());
    }

    private static Map<String, String> parseHeaders(JsonNode node) {
        Map<String, String> headers = new LinkedHashMap<>();
        node.fields().forEachRemaining(entry -> {
            String value = Env.resolvePlaceholders(entry.getValue().asText());
            if (value != null) {
                headers.put(entry.getKey(), value);
            } else {
                log.warn("[RULES] Dropping header {}: unresolved placeholder", entry.getKey());
            }
        });
        return headers;
    }

    private static List<String> parseList(JsonNode array) {
        List<String> values = new ArrayList<>();
        for (JsonNode item : array) {
            String value = Env.resolvePlaceholders(item.asText());
            if (value != null) {
                values.add(value);
            }
        }
        return values;
    }

    private static Set<String> parseStrings(JsonNode array) {
        Set<String> values = new LinkedHashSet<>();
        for (JsonNode item : array) {
            values.add(item.asText());
        }
        return values;
    }
}
