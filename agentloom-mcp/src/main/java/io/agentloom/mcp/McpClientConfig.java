package io.agentloom.mcp;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/// Connection settings shared by both MCP transports.
///
/// ### Default Values
/// - `connectTimeout`: `15s` until the stream delivers its endpoint
/// - `requestTimeout`: `60s` per request
/// - `heartbeatInterval`: `10s` between pings (stream transport)
/// - `reconnectDelay`: `500ms` before the single reconnect after a stream failure
/// - `protocolVersion`: `2024-11-05`
/// - `clientName`: `AgentloomMcpClient`
///
/// @implNote Immutable once built.
public final class McpClientConfig {

    private final Duration connectTimeout;
    private final Duration requestTimeout;
    private final Duration heartbeatInterval;
    private final Duration reconnectDelay;
    private final String protocolVersion;
    private final String clientName;
    private final Map<String, String> headers;

    private McpClientConfig(Builder builder) {
        this.connectTimeout = builder.connectTimeout;
        this.requestTimeout = builder.requestTimeout;
        this.heartbeatInterval = builder.heartbeatInterval;
        this.reconnectDelay = builder.reconnectDelay;
        this.protocolVersion = builder.protocolVersion;
        this.clientName = builder.clientName;
        this.headers = Map.copyOf(builder.headers);
    }

    public static McpClientConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public Duration getHeartbeatInterval() {
        return heartbeatInterval;
    }

    public Duration getReconnectDelay() {
        return reconnectDelay;
    }

    public String getProtocolVersion() {
        return protocolVersion;
    }

    public String getClientName() {
        return clientName;
    }

    /// Returns extra HTTP headers sent with every stream and POST request.
    ///
    /// @return unmodifiable headers, never null
    public Map<String, String> getHeaders() {
        return headers;
    }

    public static class Builder {
        private Duration connectTimeout = Duration.ofSeconds(15);
        private Duration requestTimeout = Duration.ofSeconds(60);
        private Duration heartbeatInterval = Duration.ofSeconds(10);
        private Duration reconnectDelay = Duration.ofMillis(500);
        private String protocolVersion = "2024-11-05";
        private String clientName = "AgentloomMcpClient";
        private final Map<String, String> headers = new LinkedHashMap<>();

        private Builder() {}

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public Builder heartbeatInterval(Duration heartbeatInterval) {
            this.heartbeatInterval = heartbeatInterval;
            return this;
        }

        public Builder reconnectDelay(Duration reconnectDelay) {
            this.reconnectDelay = reconnectDelay;
            return this;
        }

        public Builder protocolVersion(String protocolVersion) {
            this.protocolVersion = protocolVersion;
            return this;
        }

        public Builder clientName(String clientName) {
            this.clientName = clientName;
            return this;
        }

        public Builder header(String name, String value) {
            this.headers.put(name, value);
            return this;
        }

        public McpClientConfig build() {
            return new McpClientConfig(this);
        }
    }
}
