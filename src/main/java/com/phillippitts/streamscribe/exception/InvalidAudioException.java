package com.phillippitts.streamscribe.exception;

/**
 * Thrown when a submitted audio payload cannot be decoded into float32 samples
 * (for example a byte body whose length is not a multiple of four).
 *
 * <p>The pipeline itself never validates sample range or rate; this exception only guards
 * the byte-level decoding done at the REST boundary.
 */
public class InvalidAudioException extends StreamScribeException {

    private final int audioSize;
    private final String reason;

    public InvalidAudioException(String reason) {
        super("Invalid audio data: " + reason);
        this.audioSize = 0;
        this.reason = reason;
    }

    public InvalidAudioException(int audioSize, String reason) {
        super("Invalid audio data (" + audioSize + " bytes): " + reason);
        this.audioSize = audioSize;
        this.reason = reason;
    }

    public int getAudioSize() {
        return audioSize;
    }

    public String getReason() {
        return reason;
    }
}
