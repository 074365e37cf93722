package io.eventstreams.core;

import java.io.IOException;
import java.util.Objects;

/**
 * Drives an {@link IncrementalDecoder} from an upstream {@link EventReader}.
 *
 * <p>The upstream is read only when the decoder answers {@code NEEDS_MORE}, which is the single
 * point where {@link #next()} can block. A {@code FAIL} step is thrown from the call that hit it;
 * the reader is finished afterwards.
 */
public final class DecodingReader<I, O> implements EventReader<O> {

    private final EventReader<? extends I> upstream;
    private final IncrementalDecoder<I, O> decoder;
    private boolean done;

    public DecodingReader(EventReader<? extends I> upstream, IncrementalDecoder<I, O> decoder) {
        this.upstream = Objects.requireNonNull(upstream, "upstream");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
    }

    @Override
    public O next() throws IOException {
        if (done) return null;
        try {
            while (true) {
                DecodeStep<O> step = decoder.poll();
                if (step.kind() == DecodeStep.Kind.NEEDS_MORE) {
                    step = decoder.ingest(upstream.next());
                }
                switch (step.kind()) {
                    case EMIT:
                        return step.value();
                    case END:
                        done = true;
                        return null;
                    case FAIL:
                        done = true;
                        throw step.error();
                    case NOOP:
                        break;
                    default:
                        throw new IllegalStateException("unexpected step " + step);
                }
            }
        } catch (IOException | RuntimeException e) {
            done = true;
            throw e;
        }
    }

    @Override
    public void close() throws IOException {
        done = true;
        upstream.close();
    }
}
