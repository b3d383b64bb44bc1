package io.mcpstudio.core.event;

/// Publish-only sink for {@link DomainEvent}s.
///
/// The client core holds a reference to one publisher and never depends on how events
/// reach their subscribers.
///
/// ### Contract
/// - `publish` must not block the caller on subscriber work
/// - failures of downstream subscribers must not propagate to the caller
/// - events for the same server id are delivered in publication order
///
/// @implNote Implementations must be thread-safe, events are published from
/// connection, heartbeat and caller threads.
@FunctionalInterface
public interface EventPublisher {

    /// Publishes an event, best-effort and fire-and-forget.
    ///
    /// @param event the event, never null
    void publish(DomainEvent event);
}
