package org.netpreserve.domainprober.fetch;

import org.netpreserve.domainprober.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandlers;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fetcher backed by the JDK HTTP client. Redirects are followed by the client itself.
 */
public class HttpFetcher implements Fetcher {
    private static final Logger log = LoggerFactory.getLogger(HttpFetcher.class);
    private final HttpClient httpClient;

    public HttpFetcher(Duration connectTimeout) {
        this(HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(connectTimeout)
                .build());
    }

    public HttpFetcher(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public FetchResponse fetch(Url url, Duration timeout, Map<String, String> headers)
            throws TransportException, InterruptedException {
        HttpRequest request;
        try {
            var builder = HttpRequest.newBuilder(url.toURI())
                    .timeout(timeout)
                    .GET();
            headers.forEach(builder::header);
            request = builder.build();
        } catch (URISyntaxException | IllegalArgumentException e) {
            throw new TransportException("Invalid URL " + url + ": " + e.getMessage(), e);
        }

        CompletableFuture<HttpResponse<String>> future = httpClient.sendAsync(request, BodyHandlers.ofString());
        try {
            // the request timeout only covers the response headers, so bound the body download too
            var response = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return new FetchResponse(response.statusCode(), response.body());
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TransportTimeoutException("Timed out after " + timeout.toMillis() + "ms fetching " + url);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof HttpTimeoutException) {
                throw new TransportTimeoutException("Timed out fetching " + url + ": " + cause.getMessage());
            }
            log.trace("Fetch of {} failed", url, cause);
            throw new TransportException(cause.getClass().getSimpleName() + " fetching " + url +
                                         (cause.getMessage() == null ? "" : ": " + cause.getMessage()), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }
}
