package io.fullerstack.uptime.core.probe;

import io.fullerstack.uptime.core.model.MonitoredTarget;
import io.fullerstack.uptime.core.model.ProbeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;

/**
 * Probes a target with a single HTTP GET.
 *
 * <h3>Classification:</h3>
 * <ul>
 *   <li>Final response 2xx → reachable</li>
 *   <li>Any other final response → down, with the status code and {@code "HTTP Error <code>"}</li>
 *   <li>No response (timeout, DNS, refused, malformed URL) → down, no status code</li>
 * </ul>
 *
 * <p>Redirects are followed ({@link HttpClient.Redirect#NORMAL}: never from HTTPS to HTTP).
 * A 3xx that is still the final response counts as down.
 *
 * <p>The response body is discarded.
 */
public class HttpProber implements Prober {

    private static final Logger logger = LoggerFactory.getLogger(HttpProber.class);

    private final HttpClient httpClient;
    private final ProbeSettings settings;

    public HttpProber(ProbeSettings settings) {
        this(HttpClient.newBuilder()
                .connectTimeout(settings.timeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build(),
            settings);
    }

    public HttpProber(HttpClient httpClient, ProbeSettings settings) {
        this.httpClient = httpClient;
        this.settings = settings;
    }

    @Override
    public ProbeResult probe(MonitoredTarget target) {
        String url = target.normalizedUrl();
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(url))
                .GET()
                .timeout(settings.timeout())
                .header("User-Agent", settings.userAgent())
                .build();
        } catch (IllegalArgumentException e) {
            logger.debug("Malformed URL {}: {}", url, e.getMessage());
            return ProbeResult.unreachable("Invalid URL: " + e.getMessage());
        }

        try {
            HttpResponse<Void> response = httpClient.send(request, HttpResponse.BodyHandlers.discarding());
            int status = response.statusCode();
            logger.debug("Probe {} answered {}", url, status);

            if (status >= 200 && status < 300) {
                return ProbeResult.up(status);
            }
            return ProbeResult.httpError(status, "HTTP Error " + status);

        } catch (HttpTimeoutException e) {
            logger.debug("Probe {} timed out after {}", url, settings.timeout());
            return ProbeResult.unreachable("Timed out after " + settings.timeout().toMillis() + "ms: " + describe(e));
        } catch (IOException e) {
            logger.debug("Probe {} failed: {}", url, describe(e));
            return ProbeResult.unreachable(describe(e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ProbeResult.unreachable("Probe interrupted");
        } catch (RuntimeException e) {
            logger.warn("Probe {} failed unexpectedly", url, e);
            return ProbeResult.unreachable(describe(e));
        }
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        if (message == null || message.isBlank()) {
            Throwable cause = e.getCause();
            if (cause != null && cause.getMessage() != null) {
                return e.getClass().getSimpleName() + ": " + cause.getMessage();
            }
            return e.getClass().getSimpleName();
        }
        return e.getClass().getSimpleName() + ": " + message;
    }
}
