package io.agentloom.core.event;

/// Receives {@link LifecycleEvent}s.
///
/// Called synchronously on the emitting agent's thread; agents of a parallel stage
/// call concurrently. Exceptions are logged and otherwise ignored.
@FunctionalInterface
public interface LifecycleListener {

    /// Handles one event.
    ///
    /// @param event the event, not null
    void onEvent(LifecycleEvent event);
}
