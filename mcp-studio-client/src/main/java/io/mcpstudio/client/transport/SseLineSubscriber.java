package io.mcpstudio.client.transport;

import java.util.Objects;
import java.util.concurrent.Flow;
import java.util.function.Consumer;

/// Line subscriber that feeds an HTTP response body into an {@link SseEventParser}.
///
/// Used with `BodySubscribers.fromLineSubscriber`. Cancelling the subscription aborts the
/// underlying HTTP exchange.
final class SseLineSubscriber implements Flow.Subscriber<String> {

    private final SseEventParser parser;
    private final Runnable onComplete;
    private final Consumer<Throwable> onError;
    private volatile Flow.Subscription subscription;
    private volatile boolean cancelled;

    SseLineSubscriber(Consumer<SseEvent> onEvent, Runnable onComplete, Consumer<Throwable> onError) {
        this.parser = new SseEventParser(Objects.requireNonNull(onEvent, "onEvent must not be null"));
        this.onComplete = Objects.requireNonNull(onComplete, "onComplete must not be null");
        this.onError = Objects.requireNonNull(onError, "onError must not be null");
    }

    @Override
    public void onSubscribe(Flow.Subscription subscription) {
        this.subscription = subscription;
        if (cancelled) {
            subscription.cancel();
            return;
        }
        subscription.request(Long.MAX_VALUE);
    }

    @Override
    public void onNext(String line) {
        parser.feed(line);
    }

    @Override
    public void onError(Throwable throwable) {
        if (!cancelled) {
            onError.accept(throwable);
        }
    }

    @Override
    public void onComplete() {
        parser.flush();
        if (!cancelled) {
            onComplete.run();
        }
    }

    /// Stops consuming the stream.
    void cancel() {
        cancelled = true;
        Flow.Subscription current = subscription;
        if (current != null) {
            current.cancel();
        }
    }
}
