package in.sitewatch.infrastructure.channel;

import in.sitewatch.application.port.output.ChannelDeliveryException;
import in.sitewatch.domain.rule.ChannelType;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * Posts JSON bodies for the HTTP-based channels and maps every failure to
 * {@link ChannelDeliveryException}.
 */
public final class JsonHttpPoster {

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);

    private final HttpClient httpClient;

    public JsonHttpPoster() {
        this(HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build());
    }

    public JsonHttpPoster(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    /**
     * POST the body and require a 2xx response.
     *
     * @throws ChannelDeliveryException on non-2xx, network failure or interruption
     */
    public void post(ChannelType channel, String alertId, String url, Map<String, String> headers, String body) {
        HttpRequest.Builder request = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .timeout(REQUEST_TIMEOUT)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body));
        headers.forEach(request::setHeader);

        HttpResponse<String> response;
        try {
            response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ChannelDeliveryException(channel, alertId, "POST " + url + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ChannelDeliveryException(channel, alertId, "Interrupted while posting to " + url, e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new ChannelDeliveryException(channel, alertId, "HTTP " + status + " from " + url);
        }
    }
}
