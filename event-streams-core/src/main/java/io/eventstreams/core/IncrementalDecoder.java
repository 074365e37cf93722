package io.eventstreams.core;

/**
 * Push/pull state machine turning upstream elements into output elements.
 *
 * <p>The driver calls {@link #poll()} until it answers {@link DecodeStep.Kind#NEEDS_MORE}, then
 * fetches one upstream element and hands it to {@link #ingest(Object)}. Neither method blocks or
 * performs I/O, so the same machine can be driven by a blocking reader or by a reactive pipeline.
 *
 * @param <I> upstream element type
 * @param <O> output element type
 */
public interface IncrementalDecoder<I, O> {

    /**
     * Decides what happens next from the buffered state alone.
     *
     * @return {@code EMIT}, {@code NEEDS_MORE}, {@code NOOP}, {@code END} or {@code FAIL}
     */
    DecodeStep<O> poll();

    /**
     * Ingests one upstream element. Only valid after {@link #poll()} returned {@code NEEDS_MORE}.
     *
     * @param value the element, or {@code null} when the upstream is exhausted
     * @return {@code EMIT}, {@code NOOP} or {@code END}
     */
    DecodeStep<O> ingest(I value);
}
