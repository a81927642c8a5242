package io.agentloom.core.capability;

import java.io.Serial;

/// Thrown when a capability cannot be resolved or fails in its transport.
///
/// Provider-specific clients extend this type so that the runtime can route any
/// capability failure through the policy pipeline uniformly.
public class CapabilityException extends RuntimeException {

    @Serial private static final long serialVersionUID = -6180472297416621958L;

    public CapabilityException(String message) {
        super(message);
    }

    public CapabilityException(String message, Throwable cause) {
        super(message, cause);
    }

    /// Creates an exception for a name that no table entry matches.
    ///
    /// @param name requested capability name
    /// @return new exception, never null
    public static CapabilityException notFound(String name) {
        return new CapabilityException(name + " capability does not exist");
    }
}
