package io.eventstreams.reactor;

import io.eventstreams.core.DecodeStep;
import io.eventstreams.core.IncrementalDecoder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Feeds one upstream signal into an {@link IncrementalDecoder} and collects every step it makes
 * before it needs the next one. {@link Optional#empty()} marks upstream completion.
 *
 * <p>Not thread-safe; one instance per subscription.
 */
final class DecoderPump<I, O> {

    private final IncrementalDecoder<I, O> decoder;
    private boolean ended;

    DecoderPump(IncrementalDecoder<I, O> decoder) {
        this.decoder = decoder;
    }

    List<DecodeStep<O>> feed(Optional<I> signal) {
        if (ended) return Collections.emptyList();
        List<DecodeStep<O>> steps = new ArrayList<>(2);
        drain(steps);
        if (ended) return steps;

        DecodeStep<O> step = decoder.ingest(signal.orElse(null));
        collect(step, steps);
        if (!ended) drain(steps);
        return steps;
    }

    private void drain(List<DecodeStep<O>> steps) {
        while (!ended) {
            DecodeStep<O> step = decoder.poll();
            if (step.kind() == DecodeStep.Kind.NEEDS_MORE) return;
            collect(step, steps);
        }
    }

    private void collect(DecodeStep<O> step, List<DecodeStep<O>> steps) {
        switch (step.kind()) {
            case EMIT:
                steps.add(step);
                break;
            case END:
            case FAIL:
                steps.add(step);
                ended = true;
                break;
            case NOOP:
            case NEEDS_MORE:
                break;
            default:
                throw new IllegalStateException("unexpected step " + step);
        }
    }
}
