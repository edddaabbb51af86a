package in.sitewatch.infrastructure.channel;

import in.sitewatch.application.port.output.ChannelHandler;
import in.sitewatch.domain.alert.Alert;
import in.sitewatch.domain.channel.NotificationPayload;
import in.sitewatch.domain.rule.ChannelConfig;

import java.io.PrintStream;
import java.util.Locale;

/**
 * Writes one line per notification, e.g. {@code [ALERT] [CRITICAL] Disk full: /var at 98%}.
 */
public final class ConsoleChannelHandler implements ChannelHandler {

    private final PrintStream out;

    public ConsoleChannelHandler() {
        this(System.out);
    }

    public ConsoleChannelHandler(PrintStream out) {
        this.out = out;
    }

    @Override
    public void send(NotificationPayload payload, ChannelConfig config) {
        out.println(format(payload));
    }

    static String format(NotificationPayload payload) {
        Alert alert = payload.alert();
        String prefix = payload.isEscalation()
            ? "[ESCALATION L" + payload.escalationLevel() + "]"
            : "[ALERT]";
        return String.format("%s [%s] %s: %s",
            prefix, alert.getSeverity().name().toUpperCase(Locale.ROOT), alert.getTitle(), alert.getMessage());
    }
}
