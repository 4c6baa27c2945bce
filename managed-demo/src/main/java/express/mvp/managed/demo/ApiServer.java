package express.mvp.managed.demo;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.logging.Logger;

/**
 * HTTP server answering {@code GET /hello} with {@code 200 hello}.
 *
 * <p>Implements {@link AutoCloseable}, so {@link express.mvp.managed.Managed#from} tears it down
 * without an explicit teardown function.
 */
public final class ApiServer implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(ApiServer.class.getName());

    private static final byte[] HELLO = "hello".getBytes(StandardCharsets.UTF_8);

    private final HttpServer server;

    private volatile boolean running;

    private ApiServer(HttpServer server) {
        this.server = server;
    }

    /**
     * Binds and starts the server.
     *
     * @param settings supplies host and port
     * @return the running server
     * @throws IOException if the port cannot be bound
     */
    public static ApiServer start(DemoSettings settings) throws IOException {
        HttpServer http =
                HttpServer.create(new InetSocketAddress(settings.host(), settings.apiPort()), 0);
        http.createContext("/hello", ApiServer::hello);
        http.start();
        ApiServer api = new ApiServer(http);
        api.running = true;
        LOGGER.info(() -> "Started ApiServer on port " + api.port());
        return api;
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

    @Override
    public void close() {
        server.stop(0);
        running = false;
        LOGGER.info("Stopped ApiServer");
    }

    private static void hello(HttpExchange exchange) throws IOException {
        exchange.sendResponseHeaders(200, HELLO.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(HELLO);
        }
    }
}
