package express.mvp.managed.demo;

import java.util.Objects;

/**
 * Configuration for the demo servers.
 *
 * <h2>Configuration Options</h2>
 *
 * <table border="1">
 *   <caption>Demo Settings</caption>
 *   <tr><th>Parameter</th><th>Default</th><th>Description</th></tr>
 *   <tr><td>host</td><td>127.0.0.1</td><td>Address both servers bind to</td></tr>
 *   <tr><td>healthCheckPort</td><td>8080</td><td>Port of the health check server</td></tr>
 *   <tr><td>apiPort</td><td>7070</td><td>Port of the API server</td></tr>
 * </table>
 *
 * <p>A port of 0 binds an ephemeral port.
 */
public final class DemoSettings {

    /** Address to bind to. */
    private final String host;

    /** Port of the health check server. */
    private final int healthCheckPort;

    /** Port of the API server. */
    private final int apiPort;

    private DemoSettings(Builder builder) {
        this.host = builder.host;
        this.healthCheckPort = builder.healthCheckPort;
        this.apiPort = builder.apiPort;
    }

    /**
     * Creates a new builder with default values.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    public String host() {
        return host;
    }

    public int healthCheckPort() {
        return healthCheckPort;
    }

    public int apiPort() {
        return apiPort;
    }

    @Override
    public String toString() {
        return "DemoSettings{host="
                + host
                + ", healthCheckPort="
                + healthCheckPort
                + ", apiPort="
                + apiPort
                + '}';
    }

    /** Builder for {@link DemoSettings}. */
    public static final class Builder {
        private String host = "127.0.0.1";
        private int healthCheckPort = 8080;
        private int apiPort = 7070;

        private Builder() {}

        public Builder host(String host) {
            this.host = Objects.requireNonNull(host, "host");
            return this;
        }

        public Builder healthCheckPort(int port) {
            this.healthCheckPort = checkPort(port);
            return this;
        }

        public Builder apiPort(int port) {
            this.apiPort = checkPort(port);
            return this;
        }

        public DemoSettings build() {
            return new DemoSettings(this);
        }

        private static int checkPort(int port) {
            if (port < 0 || port > 65535) {
                throw new IllegalArgumentException("Port out of range: " + port);
            }
            return port;
        }
    }
}
