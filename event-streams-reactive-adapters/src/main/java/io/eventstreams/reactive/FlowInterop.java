package io.eventstreams.reactive;

import io.eventstreams.core.EventReader;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.Flow;
import java.util.concurrent.SubmissionPublisher;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Interop utilities for Java {@link Flow}, Reactive Streams and blocking {@link EventReader}s.
 */
public final class FlowInterop {
    private FlowInterop() {}

    public static <T> org.reactivestreams.Publisher<T> toReactiveStreams(Flow.Publisher<T> publisher) {
        Objects.requireNonNull(publisher, "publisher");
        return org.reactivestreams.FlowAdapters.toPublisher(publisher);
    }

    public static <T> Flow.Publisher<T> toFlow(org.reactivestreams.Publisher<T> publisher) {
        Objects.requireNonNull(publisher, "publisher");
        return org.reactivestreams.FlowAdapters.toFlowPublisher(publisher);
    }

    /**
     * Publishes the elements of a blocking reader.
     *
     * <p>The reader is drained on {@code executor} once the first subscriber arrives and is closed
     * when it ends, fails, or the subscriber cancels. Readers are single-pass, so a second
     * subscriber receives {@link IllegalStateException}.
     *
     * @param reader the reader to drain
     * @param executor runs the blocking pull loop
     */
    public static <T> Flow.Publisher<T> publish(EventReader<T> reader, Executor executor) {
        Objects.requireNonNull(reader, "reader");
        Objects.requireNonNull(executor, "executor");
        AtomicBoolean subscribed = new AtomicBoolean(false);
        return subscriber -> {
            Objects.requireNonNull(subscriber, "subscriber");
            if (!subscribed.compareAndSet(false, true)) {
                subscriber.onSubscribe(new Flow.Subscription() {
                    @Override
                    public void request(long n) {
                    }

                    @Override
                    public void cancel() {
                    }
                });
                subscriber.onError(new IllegalStateException("event reader already consumed"));
                return;
            }
            SubmissionPublisher<T> pub = new SubmissionPublisher<>();
            pub.subscribe(subscriber);
            executor.execute(() -> drain(reader, pub));
        };
    }

    private static <T> void drain(EventReader<T> reader, SubmissionPublisher<T> pub) {
        try (reader) {
            T value;
            while (pub.hasSubscribers() && (value = reader.next()) != null) {
                pub.submit(value);
            }
            pub.close();
        } catch (Throwable t) {
            pub.closeExceptionally(t);
        }
    }
}
