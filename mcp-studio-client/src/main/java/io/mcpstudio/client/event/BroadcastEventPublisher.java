package io.mcpstudio.client.event;

import io.mcpstudio.core.event.DomainEvent;
import io.mcpstudio.core.event.EventPublisher;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import io.smallrye.mutiny.operators.multi.processors.BroadcastProcessor;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.Objects;
import java.util.concurrent.Executor;
import org.jboss.logging.Logger;

/// Fans domain events out to any number of subscribers.
///
/// Publishing is serialized, so events reach every subscriber in publication order.
/// Delivery happens on a worker executor: a slow or failing subscriber never blocks or
/// breaks the publishing connection.
///
/// ### Usage
/// {@snippet :
/// publisher.connectionLost()
///         .subscribe()
///         .with(notification -> ui.showDisconnected(notification));
/// }
///
/// Subscribers only see events published after they subscribed.
@ApplicationScoped
public class BroadcastEventPublisher implements EventPublisher {

    private static final Logger LOG = Logger.getLogger(BroadcastEventPublisher.class);

    private final BroadcastProcessor<DomainEvent> processor = BroadcastProcessor.create();
    private final Executor deliveryExecutor;

    public BroadcastEventPublisher() {
        this(Infrastructure.getDefaultWorkerPool());
    }

    public BroadcastEventPublisher(Executor deliveryExecutor) {
        this.deliveryExecutor =
                Objects.requireNonNull(deliveryExecutor, "deliveryExecutor must not be null");
    }

    @Override
    public synchronized void publish(DomainEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        LOG.debugv("Publishing {0} for {1}", event.type(), event.serverId());
        try {
            processor.onNext(event);
        } catch (RuntimeException e) {
            LOG.warnv(e, "Failed to deliver {0} for {1}", event.type(), event.serverId());
        }
    }

    /// Subscribes to all events.
    ///
    /// @return event stream delivered off the publishing thread
    public Multi<DomainEvent> subscribe() {
        return processor.emitOn(deliveryExecutor);
    }

    /// Subscribes to the events of one server.
    ///
    /// @param serverId server to follow, not null
    /// @return filtered event stream
    public Multi<DomainEvent> subscribe(String serverId) {
        Objects.requireNonNull(serverId, "serverId must not be null");
        return subscribe().select().where(event -> serverId.equals(event.serverId()));
    }

    /// Subscribes to lost connections in their user-facing form.
    ///
    /// @return notification stream
    public Multi<ConnectionLostNotification> connectionLost() {
        return subscribe()
                .select()
                .where(event -> event instanceof DomainEvent.ConnectionLost)
                .map(event -> ConnectionLostNotification.from((DomainEvent.ConnectionLost) event));
    }

    /// Completes every subscriber stream.
    @PreDestroy
    public synchronized void shutdown() {
        processor.onComplete();
    }
}
