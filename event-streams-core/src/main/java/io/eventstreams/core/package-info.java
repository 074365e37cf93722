/**
 * Incremental codecs between chunked byte streams and typed events.
 *
 * <p>This module is framework-neutral. It contains:
 * <ul>
 *   <li>The state machines: {@link io.eventstreams.core.DelimiterFrameDecoder} for LF lines,
 *       SSE lines and JSON Text Sequences, and {@link io.eventstreams.core.ServerSentEventAssembler}</li>
 *   <li>Serializers producing the exact wire bytes of each format</li>
 *   <li>Blocking pull readers and the {@link io.eventstreams.core.EventStreams} facade</li>
 * </ul>
 *
 * <p>Reactive bindings live in other modules.
 */
package io.eventstreams.core;
