package com.phillippitts.streamscribe.domain;

/**
 * One decoded token inside a {@link Segment}, as reported by the engine.
 *
 * <p>Opaque to the pipeline: token fields are carried through to consumers but never
 * interpreted by accumulation or dispatch.
 *
 * @param id         vocabulary id of the token
 * @param logProb    natural log of the token probability
 * @param startTicks token start in engine ticks (10 ms units for whisper.cpp)
 * @param endTicks   token end in engine ticks
 * @param text       token text as decoded by the engine (may contain leading spaces)
 */
public record Token(
        int id,
        float logProb,
        long startTicks,
        long endTicks,
        String text
) {
    public Token {
        text = text == null ? "" : text;
    }
}
