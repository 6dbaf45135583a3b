package com.phillippitts.streamscribe.domain;

import java.util.List;

/**
 * One timed text segment produced by an inference call.
 *
 * <p>The pipeline only concatenates {@link #text()} across segments to build the delivered
 * utterance; timing and token fields are passed through untouched.
 *
 * @param text       segment text (whisper.cpp usually prefixes it with a space)
 * @param startTicks segment start in engine ticks
 * @param endTicks   segment end in engine ticks
 * @param tokens     decoded tokens, in order (never null)
 */
public record Segment(
        String text,
        long startTicks,
        long endTicks,
        List<Token> tokens
) {
    public Segment {
        text = text == null ? "" : text;
        tokens = tokens == null ? List.of() : List.copyOf(tokens);
    }

    /**
     * Creates a segment without token detail.
     */
    public static Segment of(String text, long startTicks, long endTicks) {
        return new Segment(text, startTicks, endTicks, List.of());
    }
}
