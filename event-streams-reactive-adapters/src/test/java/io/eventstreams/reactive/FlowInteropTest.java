package io.eventstreams.reactive;

import io.eventstreams.core.ByteChunks;
import io.eventstreams.core.EventReader;
import io.eventstreams.core.EventStreamException;
import io.eventstreams.core.EventStreams;
import io.eventstreams.core.ServerSentEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Flow;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class FlowInteropTest {

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void publishesDecodedEventsInOrder() throws Exception {
        EventReader<ServerSentEvent> events = EventStreams.decodeServerSentEvents(
                ByteChunks.ofUtf8("data: a\n\ndata: b\n\n"));

        TestSubscriber<ServerSentEvent> subscriber = new TestSubscriber<>();
        FlowInterop.publish(events, executor).subscribe(subscriber);

        assertThat(subscriber.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(subscriber.items()).containsExactly(ServerSentEvent.ofData("a"), ServerSentEvent.ofData("b"));
        assertThat(subscriber.error()).isNull();
    }

    @Test
    void structuralFailureReachesSubscriber() throws Exception {
        EventReader<byte[]> frames = EventStreams.decodeJsonSequenceFrames(ByteChunks.ofUtf8("{}"));

        TestSubscriber<byte[]> subscriber = new TestSubscriber<>();
        FlowInterop.publish(frames, executor).subscribe(subscriber);

        assertThat(subscriber.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(subscriber.items()).isEmpty();
        assertThat(subscriber.error()).isInstanceOf(EventStreamException.MissingInitialRecordSeparator.class);
    }

    @Test
    void secondSubscriberIsRejected() throws Exception {
        Flow.Publisher<String> pub = FlowInterop.publish(EventReader.of(List.of("x")), executor);
        TestSubscriber<String> first = new TestSubscriber<>();
        pub.subscribe(first);
        assertThat(first.await(5, TimeUnit.SECONDS)).isTrue();

        TestSubscriber<String> second = new TestSubscriber<>();
        pub.subscribe(second);

        assertThat(second.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(second.error()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void convertsBetweenFlowAndReactiveStreams() throws Exception {
        Flow.Publisher<String> flow = FlowInterop.publish(EventReader.of(List.of("p", "q")), executor);

        TestSubscriber<String> subscriber = new TestSubscriber<>();
        FlowInterop.toFlow(FlowInterop.toReactiveStreams(flow)).subscribe(subscriber);

        assertThat(subscriber.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(subscriber.items()).containsExactly("p", "q");
    }

    static final class TestSubscriber<T> implements Flow.Subscriber<T> {
        private final List<T> items = Collections.synchronizedList(new ArrayList<>());
        private final CountDownLatch done = new CountDownLatch(1);
        private volatile Throwable error;

        @Override
        public void onSubscribe(Flow.Subscription subscription) {
            subscription.request(Long.MAX_VALUE);
        }

        @Override
        public void onNext(T item) {
            items.add(item);
        }

        @Override
        public void onError(Throwable throwable) {
            error = throwable;
            done.countDown();
        }

        @Override
        public void onComplete() {
            done.countDown();
        }

        boolean await(long timeout, TimeUnit unit) throws InterruptedException {
            return done.await(timeout, unit);
        }

        List<T> items() {
            return items;
        }

        Throwable error() {
            return error;
        }
    }
}
