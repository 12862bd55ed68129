package fr.lapetina.failover.infrastructure.http;

import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Loopback HTTP origin for tests.
 *
 * Answers every request with a configurable status, body and header, optionally
 * holding the response until {@link #close()} to simulate a hung origin.
 */
public final class TestOrigin implements AutoCloseable {

    private final HttpServer server;
    private final ExecutorService executor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "test-origin");
        t.setDaemon(true);
        return t;
    });
    private final CountDownLatch release = new CountDownLatch(1);
    private final AtomicInteger hits = new AtomicInteger();

    private volatile int status = 200;
    private volatile String body = "ok";
    private volatile boolean hang;

    private volatile String lastMethod;
    private volatile String lastPath;
    private volatile String lastQuery;
    private volatile Headers lastHeaders;
    private volatile byte[] lastBody;

    public TestOrigin() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.setExecutor(executor);
        server.createContext("/", exchange -> {
            hits.incrementAndGet();
            lastMethod = exchange.getRequestMethod();
            lastPath = exchange.getRequestURI().getRawPath();
            lastQuery = exchange.getRequestURI().getRawQuery();
            lastHeaders = exchange.getRequestHeaders();
            try (InputStream is = exchange.getRequestBody()) {
                lastBody = is.readAllBytes();
            }

            if (hang) {
                try {
                    release.await(30, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }

            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "text/plain; charset=utf-8");
            exchange.getResponseHeaders().set("X-Served-By", authority());
            try {
                exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
                try (OutputStream os = exchange.getResponseBody()) {
                    if (bytes.length > 0) {
                        os.write(bytes);
                    }
                }
            } catch (IOException e) {
                // Client went away after a timeout
                exchange.close();
            }
        });
        server.start();
    }

    public TestOrigin respond(int status, String body) {
        this.status = status;
        this.body = body;
        return this;
    }

    public TestOrigin hang() {
        this.hang = true;
        return this;
    }

    public String authority() {
        return "127.0.0.1:" + server.getAddress().getPort();
    }

    public int getHits() {
        return hits.get();
    }

    public String getLastMethod() {
        return lastMethod;
    }

    public String getLastPath() {
        return lastPath;
    }

    public String getLastQuery() {
        return lastQuery;
    }

    public Headers getLastHeaders() {
        return lastHeaders;
    }

    public byte[] getLastBody() {
        return lastBody;
    }

    @Override
    public void close() {
        release.countDown();
        server.stop(0);
        executor.shutdownNow();
    }
}
