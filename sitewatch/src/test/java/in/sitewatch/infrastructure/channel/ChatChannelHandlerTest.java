package in.sitewatch.infrastructure.channel;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.sitewatch.application.port.output.ChannelDeliveryException;
import in.sitewatch.domain.alert.AlertSeverity;
import in.sitewatch.domain.channel.ChannelSettings;
import in.sitewatch.domain.channel.NotificationPayload;
import in.sitewatch.domain.rule.ChannelConfig;
import in.sitewatch.domain.rule.ChannelType;
import in.sitewatch.domain.rule.RetryPolicy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ChatChannelHandlerTest {

    @Mock
    private JsonHttpPoster poster;

    @Test
    void buildsColourCodedAttachment() {
        ChatChannelHandler handler = new ChatChannelHandler(poster);

        ObjectNode message = handler.buildMessage(NotificationPayload.initial(WebhookChannelHandlerTest.alert(), null), "#alerts");

        assertEquals("#alerts", message.path("channel").asText());
        assertEquals("ALERT: DB down", message.path("text").asText());
        JsonNode attachment = message.path("attachments").get(0);
        assertEquals("danger", attachment.path("color").asText());
        assertEquals("conn refused", attachment.path("text").asText());
        assertEquals("Severity", attachment.path("fields").get(0).path("title").asText());
        assertEquals("CRITICAL", attachment.path("fields").get(0).path("value").asText());
        assertEquals("Monitoring System", attachment.path("footer").asText());
        assertEquals(1709287200L, attachment.path("ts").asLong());
    }

    @Test
    void escalationTextCarriesLevel() {
        ChatChannelHandler handler = new ChatChannelHandler(poster);

        ObjectNode message = handler.buildMessage(
            NotificationPayload.escalation(WebhookChannelHandlerTest.alert(), null, 2), null);

        assertEquals("ESCALATION L2: DB down", message.path("text").asText());
        assertFalse(message.has("channel"));
    }

    @Test
    void colourBySeverity() {
        assertEquals("danger", ChatChannelHandler.colorFor(AlertSeverity.CRITICAL));
        assertEquals("warning", ChatChannelHandler.colorFor(AlertSeverity.ERROR));
        assertEquals("warning", ChatChannelHandler.colorFor(AlertSeverity.WARNING));
        assertEquals("good", ChatChannelHandler.colorFor(AlertSeverity.INFO));
    }

    @Test
    void postsToConfiguredWebhook() throws Exception {
        ChatChannelHandler handler = new ChatChannelHandler(poster);
        ChannelConfig config = ChannelConfig.of(ChannelType.CHAT,
            new ChannelSettings.Chat("https://hooks.example.com/T000", "#ops"), RetryPolicy.none());

        handler.send(NotificationPayload.initial(WebhookChannelHandlerTest.alert(), null), config);

        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        verify(poster).post(eq(ChannelType.CHAT), eq("alert_1709287200000_abc123def"),
            eq("https://hooks.example.com/T000"), eq(Map.of()), body.capture());
        assertTrue(body.getValue().contains("\"channel\":\"#ops\""));
    }

    @Test
    void missingWebhookFailsWithoutPosting() {
        ChatChannelHandler handler = new ChatChannelHandler(poster);
        ChannelConfig config = ChannelConfig.of(ChannelType.CHAT, new ChannelSettings.Chat(null, null), RetryPolicy.none());

        assertThrows(ChannelDeliveryException.class,
            () -> handler.send(NotificationPayload.initial(WebhookChannelHandlerTest.alert(), null), config));
        verify(poster, never()).post(any(), anyString(), anyString(), anyMap(), anyString());
    }
}
