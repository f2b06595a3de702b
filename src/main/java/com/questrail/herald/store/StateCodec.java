package com.questrail.herald.store;

import java.io.IOException;

/**
 * Byte-level encoding of a {@link StateEnvelope}.
 */
public interface StateCodec<S>
{
    byte[] encode(StateEnvelope<S> envelope) throws IOException;

    /**
     * @throws StateCorruptionException the bytes are not a readable envelope
     */
    StateEnvelope<S> decode(byte[] bytes) throws StateCorruptionException;
}
