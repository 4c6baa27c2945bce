package express.mvp.managed.demo;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.logging.Logger;

/**
 * HTTP server answering {@code GET /health} with {@code 200 ready} or {@code 503 unready}.
 *
 * <p>Starts unready. It is started before the API server and marked ready once the API server is
 * up, so a load balancer only routes traffic to a fully started process.
 */
public final class HealthCheckServer {

    private static final Logger LOGGER = Logger.getLogger(HealthCheckServer.class.getName());

    private final HttpServer server;

    private volatile boolean ready;

    private volatile boolean running;

    private HealthCheckServer(HttpServer server) {
        this.server = server;
    }

    /**
     * Binds and starts the server.
     *
     * @param settings supplies host and port
     * @return the running server
     * @throws IOException if the port cannot be bound
     */
    public static HealthCheckServer start(DemoSettings settings) throws IOException {
        HttpServer http =
                HttpServer.create(
                        new InetSocketAddress(settings.host(), settings.healthCheckPort()), 0);
        HealthCheckServer healthCheck = new HealthCheckServer(http);
        http.createContext("/health", healthCheck::handle);
        http.start();
        healthCheck.running = true;
        LOGGER.info(() -> "Started HealthCheckServer on port " + healthCheck.port());
        return healthCheck;
    }

    /** Reports ready from now on. */
    public void markReady() {
        ready = true;
        LOGGER.info("Marked HealthCheckServer ready");
    }

    /** Reports unready from now on. */
    public void markUnready() {
        ready = false;
        LOGGER.info("Marked HealthCheckServer unready");
    }

    public boolean isReady() {
        return ready;
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Returns the bound port.
     *
     * @return the port, resolved if an ephemeral port was requested
     */
    public int port() {
        return server.getAddress().getPort();
    }

    /** Stops the server, closing its port immediately. */
    public void stop() {
        server.stop(0);
        running = false;
        LOGGER.info("Stopped HealthCheckServer");
    }

    private void handle(HttpExchange exchange) throws IOException {
        boolean isReady = ready;
        byte[] body = (isReady ? "ready" : "unready").getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(isReady ? 200 : 503, body.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(body);
        }
    }
}
