package io.agentloom.core.reasoning;

/// How the reasoning engine may use the offered capabilities.
public enum ToolChoice {
    /// The engine decides between text and calls.
    AUTO,
    /// At least one call is required.
    REQUIRED,
    /// Text only.
    NONE
}
