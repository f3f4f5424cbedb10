package com.phillippitts.slidefollow.service.audio;

/**
 * Single source of truth for the audio format streamed to the recognition backend.
 * Wire format: 16 kHz, 16-bit signed PCM, mono, little-endian.
 */
public final class AudioFormat {

    /** Default streaming sample rate in Hz. */
    public static final int STREAM_SAMPLE_RATE = 16_000;
    /** Bits per streamed sample. */
    public static final int STREAM_BITS_PER_SAMPLE = 16;
    /** Streamed channels (mono). */
    public static final int STREAM_CHANNELS = 1;
    /** Bytes per streamed sample. */
    public static final int STREAM_BYTES_PER_SAMPLE = STREAM_BITS_PER_SAMPLE / 8;

    /** Capture lines are opened as signed PCM. */
    public static final boolean CAPTURE_SIGNED = true;
    /** Capture lines are opened little-endian (false = little-endian). */
    public static final boolean CAPTURE_BIG_ENDIAN = false;
    /** Bits per captured sample. */
    public static final int CAPTURE_BITS_PER_SAMPLE = 16;

    /** Scale for negative samples when quantizing to int16. */
    public static final float INT16_NEGATIVE_SCALE = 0x8000;
    /** Scale for non-negative samples when quantizing to int16. */
    public static final float INT16_POSITIVE_SCALE = 0x7FFF;

    private AudioFormat() {}
}
