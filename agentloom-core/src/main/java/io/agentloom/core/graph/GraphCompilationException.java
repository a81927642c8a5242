package io.agentloom.core.graph;

import java.io.Serial;

/// Thrown when a plan's agent list cannot be turned into an execution tree.
public class GraphCompilationException extends RuntimeException {

    @Serial private static final long serialVersionUID = 7419660187402113305L;

    public GraphCompilationException(String message) {
        super(message);
    }

    /// @return exception for a plan without any agent
    public static GraphCompilationException noExecutableAgent() {
        return new GraphCompilationException("No executable agent");
    }

    /// @return exception for a plan whose entry set is empty after repair
    public static GraphCompilationException unableToBuild() {
        return new GraphCompilationException("Unable to build execution tree");
    }
}
