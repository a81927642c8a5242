package io.agentloom.mcp;

import io.agentloom.core.capability.CapabilityException;
import java.io.Serial;

/// Thrown when an MCP operation fails.
///
/// Covers connection failures, protocol errors, timeouts and results the provider
/// marked as errors. Messages name the failed method as `MCP <method> error: <detail>`.
public class McpException extends CapabilityException {

    @Serial private static final long serialVersionUID = 2240695174028119386L;

    private final String method;

    public McpException(String message) {
        super(message);
        this.method = null;
    }

    public McpException(String message, Throwable cause) {
        super(message, cause);
        this.method = null;
    }

    /// Creates an exception for a failed protocol method.
    ///
    /// @param method JSON-RPC method that failed, not null
    /// @param detail provider or transport detail
    public McpException(String method, String detail) {
        super("MCP " + method + " error: " + detail);
        this.method = method;
    }

    /// Returns the JSON-RPC method that failed.
    ///
    /// @return method name, or null when the failure is not method-specific
    public String getMethod() {
        return method;
    }

    /// Creates an exception for a connection failure.
    ///
    /// @param endpoint the MCP endpoint
    /// @param cause the underlying cause, may be null
    /// @return new exception
    public static McpException connectionFailed(String endpoint, Throwable cause) {
        return new McpException("Failed to connect to MCP server at " + endpoint, cause);
    }

    /// Creates an exception for a request without response in time.
    ///
    /// @param method the method that timed out
    /// @param timeoutMs the timeout in milliseconds
    /// @return new exception
    public static McpException timeout(String method, long timeoutMs) {
        return new McpException(method, "no response after " + timeoutMs + "ms");
    }
}
