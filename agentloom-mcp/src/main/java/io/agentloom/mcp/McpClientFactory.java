package io.agentloom.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.agentloom.core.capability.CapabilityClient;
import java.net.URI;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/// Creates MCP clients from endpoint strings.
///
/// | Endpoint                     | Client            |
/// |------------------------------|-------------------|
/// | `http://…`, `https://…`      | {@link SseMcpClient}   |
/// | `stdio:<command> [args…]`    | {@link StdioMcpClient} |
///
/// Command arguments are separated by whitespace; quoting is not supported.
public final class McpClientFactory {

    static final String STDIO_PREFIX = "stdio:";

    private final JsonRpc jsonRpc;
    private final McpClientConfig config;

    public McpClientFactory(ObjectMapper mapper, McpClientConfig config) {
        this.jsonRpc = new JsonRpc(Objects.requireNonNull(mapper, "mapper must not be null"));
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    public McpClientFactory() {
        this(new ObjectMapper(), McpClientConfig.defaults());
    }

    /// Creates an unconnected client.
    ///
    /// @param endpoint endpoint string, not null
    /// @return new client, never null
    /// @throws IllegalArgumentException if the endpoint matches no transport
    public AbstractMcpClient create(String endpoint) {
        validate(endpoint);
        String trimmed = endpoint.trim();
        if (isStdio(trimmed)) {
            return new StdioMcpClient(command(trimmed), jsonRpc, config);
        }
        return new SseMcpClient(URI.create(trimmed), jsonRpc, config);
    }

    /// Returns a supplier creating one client per call, for
    /// {@link io.agentloom.core.runtime.AgentDefinition#remote}.
    ///
    /// The endpoint is validated eagerly.
    ///
    /// @param endpoint endpoint string, not null
    /// @return client supplier, never null
    public Supplier<CapabilityClient> supplier(String endpoint) {
        validate(endpoint);
        return () -> create(endpoint);
    }

    private static void validate(String endpoint) {
        Objects.requireNonNull(endpoint, "endpoint must not be null");
        String trimmed = endpoint.trim();
        if (isStdio(trimmed)) {
            command(trimmed);
        } else if (!trimmed.startsWith("http://") && !trimmed.startsWith("https://")) {
            throw new IllegalArgumentException("Unsupported MCP endpoint: " + endpoint);
        }
    }

    private static boolean isStdio(String endpoint) {
        return endpoint.startsWith(STDIO_PREFIX);
    }

    private static List<String> command(String endpoint) {
        String line = endpoint.substring(STDIO_PREFIX.length()).trim();
        if (line.isEmpty()) {
            throw new IllegalArgumentException("stdio endpoint without command");
        }
        return Arrays.asList(line.split("\\s+"));
    }
}
