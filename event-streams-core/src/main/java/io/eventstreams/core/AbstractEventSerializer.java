package io.eventstreams.core;

/**
 * Running/finished bookkeeping shared by the serializers.
 */
abstract class AbstractEventSerializer<I> implements EventSerializer<I> {

    private boolean finished;

    @Override
    public final byte[] ingest(I item) {
        if (finished) {
            throw new IllegalStateException(getClass().getSimpleName() + " already finished");
        }
        if (item == null) {
            finished = true;
            return null;
        }
        return encode(item);
    }

    @Override
    public final boolean isFinished() {
        return finished;
    }

    protected abstract byte[] encode(I item);
}
