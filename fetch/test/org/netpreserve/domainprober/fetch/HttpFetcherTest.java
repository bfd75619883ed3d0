package org.netpreserve.domainprober.fetch;

import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.netpreserve.domainprober.util.Url;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class HttpFetcherTest {
    private static HttpServer httpServer;
    private static ExecutorService executor;
    private static final AtomicReference<String> lastUserAgent = new AtomicReference<>();
    private final HttpFetcher fetcher = new HttpFetcher(Duration.ofSeconds(2));

    @BeforeAll
    static void setUp() throws IOException {
        httpServer = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        httpServer.createContext("/", exchange -> {
            lastUserAgent.set(exchange.getRequestHeaders().getFirst("User-Agent"));
            switch (exchange.getRequestURI().getPath()) {
                case "/ok" -> {
                    byte[] body = "Welcome to my homepage".getBytes(StandardCharsets.UTF_8);
                    exchange.getResponseHeaders().add("Content-Type", "text/html; charset=utf-8");
                    exchange.sendResponseHeaders(200, body.length);
                    exchange.getResponseBody().write(body);
                }
                case "/redirect" -> {
                    exchange.getResponseHeaders().add("Location", "/ok");
                    exchange.sendResponseHeaders(301, -1);
                }
                case "/slow" -> {
                    try {
                        Thread.sleep(3000);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    exchange.sendResponseHeaders(200, -1);
                }
                default -> exchange.sendResponseHeaders(404, -1);
            }
            exchange.close();
        });
        executor = Executors.newCachedThreadPool();
        httpServer.setExecutor(executor);
        httpServer.start();
    }

    @AfterAll
    static void tearDown() {
        httpServer.stop(0);
        executor.shutdownNow();
    }

    private static Url url(String path) {
        return new Url("http://127.0.0.1:" + httpServer.getAddress().getPort() + path);
    }

    @Test
    void returnsStatusAndBody() throws Exception {
        var response = fetcher.fetch(url("/ok"), Duration.ofSeconds(2), Map.of("User-Agent", "test-agent"));
        assertEquals(200, response.status());
        assertEquals("Welcome to my homepage", response.body());
        assertEquals("test-agent", lastUserAgent.get());
    }

    @Test
    void reportsNonSuccessStatus() throws Exception {
        var response = fetcher.fetch(url("/missing"), Duration.ofSeconds(2), Map.of());
        assertEquals(404, response.status());
        assertEquals("", response.body());
    }

    @Test
    void followsRedirects() throws Exception {
        var response = fetcher.fetch(url("/redirect"), Duration.ofSeconds(2), Map.of());
        assertEquals(200, response.status());
        assertEquals("Welcome to my homepage", response.body());
    }

    @Test
    void timesOut() {
        long start = System.nanoTime();
        assertThrows(TransportTimeoutException.class,
                () -> fetcher.fetch(url("/slow"), Duration.ofMillis(200), Map.of()));
        assertTrue(Duration.ofNanos(System.nanoTime() - start).toMillis() < 2500);
    }

    @Test
    void connectionRefusedIsTransportFailure() throws IOException {
        int port;
        try (var socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        var exception = assertThrows(TransportException.class,
                () -> fetcher.fetch(new Url("http://127.0.0.1:" + port + "/"), Duration.ofSeconds(2), Map.of()));
        assertFalse(exception instanceof TransportTimeoutException);
    }

    @Test
    void invalidHostIsTransportFailure() {
        assertThrows(TransportException.class,
                () -> fetcher.fetch(new Url("http://bad host.com"), Duration.ofSeconds(1), Map.of()));
    }
}
