package dev.lzrvc.errortracker;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Posts each event as JSON to the DSN in a single synchronous request. Non-2xx responses,
 * timeouts and I/O errors are reported to {@link Diagnostics} and not retried.
 */
public final class HttpTransport implements Transport {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    private final URI endpoint;
    private final Duration timeout;
    private final Map<String, String> headers;
    private final Diagnostics diagnostics;
    private final HttpClient httpClient;

    public HttpTransport(String dsn, Diagnostics diagnostics) {
        this(dsn, DEFAULT_TIMEOUT, Map.of(), diagnostics);
    }

    /**
     * @throws IllegalArgumentException if {@code dsn} is not a valid URI
     */
    public HttpTransport(String dsn, Duration timeout, Map<String, String> headers, Diagnostics diagnostics) {
        this.endpoint    = URI.create(dsn);
        this.timeout     = timeout;
        this.diagnostics = diagnostics;
        this.headers     = new LinkedHashMap<>();
        this.headers.put("Content-Type", "application/json");
        if (headers != null) this.headers.putAll(headers);
        this.httpClient  = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
    }

    @Override
    public void send(Event event) {
        String eventId = event.getEventId();
        try {
            HttpRequest.Builder request = HttpRequest.newBuilder()
                    .uri(endpoint)
                    .timeout(timeout)
                    .POST(HttpRequest.BodyPublishers.ofString(event.toJson()));
            headers.forEach(request::header);

            HttpResponse<String> response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() >= 200 && response.statusCode() < 300) {
                diagnostics.debug("Event sent: " + eventId + " (HTTP " + response.statusCode() + ")");
            } else {
                diagnostics.error("Failed to send event " + eventId
                        + ": HTTP " + response.statusCode() + ": " + response.body(), null);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            diagnostics.error("Interrupted while sending event " + eventId, e);
        } catch (Exception e) {
            diagnostics.error("Network error for event " + eventId, e);
        }
    }

    URI getEndpoint() {
        return endpoint;
    }
}
