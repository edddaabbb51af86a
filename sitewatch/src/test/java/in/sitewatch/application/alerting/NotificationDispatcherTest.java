package in.sitewatch.application.alerting;

import in.sitewatch.application.port.output.ChannelDeliveryException;
import in.sitewatch.application.port.output.ChannelHandler;
import in.sitewatch.domain.alert.Alert;
import in.sitewatch.domain.alert.AlertSeverity;
import in.sitewatch.domain.channel.ChannelSettings;
import in.sitewatch.domain.channel.NotificationPayload;
import in.sitewatch.domain.rule.AlertRule;
import in.sitewatch.domain.rule.ChannelConfig;
import in.sitewatch.domain.rule.ChannelType;
import in.sitewatch.domain.rule.RetryPolicy;
import in.sitewatch.infrastructure.metrics.AlertingMetrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class NotificationDispatcherTest {

    @Mock
    private ChannelHandler webhook;
    @Mock
    private ChannelHandler chat;
    @Mock
    private AlertingMetrics metrics;

    private AlertStore store;
    private RuleRegistry rules;
    private AlertTaskScheduler scheduler;
    private NotificationDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        store = new AlertStore(new MutableClock(Instant.parse("2024-03-01T10:00:00Z")), 100, true);
        rules = new RuleRegistry();
        scheduler = new AlertTaskScheduler();
        // sends run inline; retries run on the scheduler thread
        dispatcher = new NotificationDispatcher(store, rules, scheduler, Runnable::run, metrics);
        dispatcher.registerChannel(ChannelType.WEBHOOK, webhook);
        dispatcher.registerChannel(ChannelType.CHAT, chat);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    private Alert createAlert(AlertSeverity severity) {
        return store.admit("DB down", "conn refused", severity, "db-health", Set.of("infra"), Map.of()).alert();
    }

    private static ChannelDeliveryException failure(ChannelType type) {
        return new ChannelDeliveryException(type, "x", "HTTP 503");
    }

    @Test
    void sendsToMatchingRuleChannels() {
        rules.addRule(TestRules.rule("r1", AlertSeverity.ERROR).channel(TestRules.webhook(RetryPolicy.none())).build());
        rules.addRule(TestRules.rule("r2", AlertSeverity.CRITICAL).channel(TestRules.chat(RetryPolicy.none())).build());
        Alert alert = createAlert(AlertSeverity.ERROR);

        dispatcher.dispatch(alert);

        ArgumentCaptor<NotificationPayload> payload = ArgumentCaptor.forClass(NotificationPayload.class);
        verify(webhook).send(payload.capture(), any());
        verifyNoInteractions(chat);
        assertFalse(payload.getValue().isEscalation());
        assertEquals("r1", payload.getValue().rule().id());
        verify(metrics).recordDelivery(ChannelType.WEBHOOK, true, false);
    }

    @Test
    void channelsAreOrderedByPriorityAndDisabledOnesSkipped() {
        ChannelConfig chatFirst = new ChannelConfig(ChannelType.CHAT, true,
            new ChannelSettings.Chat("http://localhost/chat", null), 1, RetryPolicy.none());
        ChannelConfig webhookSecond = new ChannelConfig(ChannelType.WEBHOOK, true,
            new ChannelSettings.Webhook("http://localhost/hook"), 2, RetryPolicy.none());
        rules.addRule(TestRules.rule("r1", AlertSeverity.INFO)
            .channel(webhookSecond)
            .channel(chatFirst)
            .channel(TestRules.webhook(RetryPolicy.none()).disabled())
            .build());

        dispatcher.dispatch(createAlert(AlertSeverity.INFO));

        InOrder order = inOrder(chat, webhook);
        order.verify(chat).send(any(), any());
        order.verify(webhook).send(any(), any());
        verifyNoMoreInteractions(webhook);
    }

    @Test
    void channelWithoutHandlerIsSkipped() {
        rules.addRule(TestRules.rule("r1", AlertSeverity.INFO)
            .channel(TestRules.sms())
            .channel(TestRules.webhook(RetryPolicy.none()))
            .build());

        assertDoesNotThrow(() -> dispatcher.dispatch(createAlert(AlertSeverity.INFO)));
        verify(webhook).send(any(), any());
    }

    @Test
    void failedSendIsRetriedUntilSuccess() {
        rules.addRule(TestRules.rule("r1", AlertSeverity.INFO).channel(TestRules.webhook(TestRules.fastRetries(3))).build());
        doThrow(failure(ChannelType.WEBHOOK)).doNothing().when(webhook).send(any(), any());
        Alert alert = createAlert(AlertSeverity.INFO);

        dispatcher.dispatch(alert);

        verify(webhook, timeout(2000).times(2)).send(any(), any());
        verify(webhook, after(200).times(2)).send(any(), any());
        assertEquals(1, store.getAlert(alert.getId()).orElseThrow().getRetryCount());
        assertEquals(0, scheduler.pendingRetryCount());
        verify(metrics).recordRetryScheduled(ChannelType.WEBHOOK);
    }

    @Test
    void retriesStopAtMaxRetries() {
        rules.addRule(TestRules.rule("r1", AlertSeverity.INFO).channel(TestRules.webhook(TestRules.fastRetries(2))).build());
        doThrow(failure(ChannelType.WEBHOOK)).when(webhook).send(any(), any());
        Alert alert = createAlert(AlertSeverity.INFO);

        dispatcher.dispatch(alert);

        verify(webhook, timeout(2000).times(3)).send(any(), any());
        verify(webhook, after(300).times(3)).send(any(), any());
        assertEquals(2, store.getAlert(alert.getId()).orElseThrow().getRetryCount());
        verify(metrics, timeout(1000)).recordDeliveryDropped(ChannelType.WEBHOOK);
    }

    @Test
    void retryBudgetIsSharedAcrossChannels() {
        rules.addRule(TestRules.rule("r1", AlertSeverity.INFO)
            .channel(TestRules.webhook(TestRules.fastRetries(1)))
            .channel(TestRules.chat(TestRules.fastRetries(1)))
            .build());
        doThrow(failure(ChannelType.WEBHOOK)).when(webhook).send(any(), any());
        doThrow(failure(ChannelType.CHAT)).when(chat).send(any(), any());
        Alert alert = createAlert(AlertSeverity.INFO);

        dispatcher.dispatch(alert);

        verify(webhook, timeout(2000).times(2)).send(any(), any());
        verify(chat, timeout(2000).times(2)).send(any(), any());
        verify(webhook, after(300).times(2)).send(any(), any());
        verify(chat, times(2)).send(any(), any());
        assertEquals(2, store.getAlert(alert.getId()).orElseThrow().getRetryCount());
    }

    @Test
    void retryForResolvedAlertIsDropped() {
        RetryPolicy slow = new RetryPolicy(3, 0.005, 1.0);
        rules.addRule(TestRules.rule("r1", AlertSeverity.INFO).channel(TestRules.webhook(slow)).build());
        doThrow(failure(ChannelType.WEBHOOK)).when(webhook).send(any(), any());
        Alert alert = createAlert(AlertSeverity.INFO);

        dispatcher.dispatch(alert);
        store.resolve(alert.getId(), "oncall");

        verify(webhook, after(800).times(1)).send(any(), any());
        assertEquals(0, store.getAlert(alert.getId()).orElseThrow().getRetryCount());
    }

    @Test
    void shutdownCancelsPendingRetries() {
        rules.addRule(TestRules.rule("r1", AlertSeverity.INFO)
            .channel(TestRules.webhook(RetryPolicy.defaults()))
            .build());
        doThrow(failure(ChannelType.WEBHOOK)).when(webhook).send(any(), any());

        dispatcher.dispatch(createAlert(AlertSeverity.INFO));
        assertEquals(1, scheduler.pendingRetryCount());

        scheduler.shutdown();
        assertEquals(0, scheduler.pendingRetryCount());
    }

    @Test
    void escalationSendUsesStepChannels() {
        AlertRule rule = TestRules.rule("r1", AlertSeverity.INFO)
            .channel(TestRules.webhook(RetryPolicy.none()))
            .escalation(TestRules.step(1, 15, null, TestRules.chat(RetryPolicy.none())))
            .build();
        rules.addRule(rule);
        Alert alert = store.escalate(createAlert(AlertSeverity.CRITICAL).getId(), 1).orElseThrow();

        dispatcher.dispatchEscalation(alert, rule, rule.escalationForLevel(1).orElseThrow());

        ArgumentCaptor<NotificationPayload> payload = ArgumentCaptor.forClass(NotificationPayload.class);
        verify(chat).send(payload.capture(), any());
        verifyNoInteractions(webhook);
        assertTrue(payload.getValue().isEscalation());
        assertEquals(1, payload.getValue().escalationLevel());
    }

    @Test
    void sameTypeChannelsKeepSeparateRetries() {
        RetryPolicy slow = new RetryPolicy(3, 5, 2.0);
        rules.addRule(TestRules.rule("r1", AlertSeverity.INFO)
            .channel(ChannelConfig.of(ChannelType.WEBHOOK, new ChannelSettings.Webhook("http://a/hook"), slow))
            .channel(ChannelConfig.of(ChannelType.WEBHOOK, new ChannelSettings.Webhook("http://b/hook"), slow))
            .build());
        doThrow(failure(ChannelType.WEBHOOK)).when(webhook).send(any(), any());
        Alert alert = createAlert(AlertSeverity.INFO);

        dispatcher.dispatch(alert);

        verify(webhook, times(2)).send(any(), any());
        assertEquals(2, scheduler.pendingRetryCount());
        assertTrue(scheduler.hasPendingRetry(new RetryKey(alert.getId(), "r1", 0, 0, ChannelType.WEBHOOK)));
        assertTrue(scheduler.hasPendingRetry(new RetryKey(alert.getId(), "r1", 0, 1, ChannelType.WEBHOOK)));
    }

    @Test
    void eachLadderStepKeepsItsOwnRetry() {
        RetryPolicy slow = new RetryPolicy(3, 5, 2.0);
        AlertRule rule = TestRules.rule("r1", AlertSeverity.INFO)
            .channel(TestRules.webhook(slow))
            .escalation(TestRules.step(1, 15, null, TestRules.webhook(slow)))
            .escalation(TestRules.step(2, 30, null, TestRules.webhook(slow)))
            .build();
        rules.addRule(rule);
        doThrow(failure(ChannelType.WEBHOOK)).when(webhook).send(any(), any());
        Alert alert = createAlert(AlertSeverity.CRITICAL);

        dispatcher.dispatch(alert);
        dispatcher.dispatchEscalation(alert, rule, rule.escalationForLevel(1).orElseThrow());
        dispatcher.dispatchEscalation(alert, rule, rule.escalationForLevel(2).orElseThrow());

        assertEquals(3, scheduler.pendingRetryCount());
        assertTrue(scheduler.hasPendingRetry(new RetryKey(alert.getId(), "r1", 2, 0, ChannelType.WEBHOOK)));
    }

    @Test
    void rejectedExecutionDoesNotReachCaller() {
        NotificationDispatcher closed = new NotificationDispatcher(store, rules, scheduler, task -> {
            throw new java.util.concurrent.RejectedExecutionException("stopped");
        }, metrics);

        assertDoesNotThrow(() -> closed.dispatch(createAlert(AlertSeverity.INFO)));
    }
}
