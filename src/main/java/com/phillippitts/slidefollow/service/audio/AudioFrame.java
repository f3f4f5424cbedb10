package com.phillippitts.slidefollow.service.audio;

import java.util.Objects;

/**
 * A block of captured audio as floating-point samples in [-1, 1].
 *
 * <p>Samples are interleaved when {@code channels > 1}; the array is owned by the frame and must
 * not be modified after construction.
 */
public record AudioFrame(float[] samples, int channels, int sampleRate) {

    public AudioFrame {
        Objects.requireNonNull(samples, "samples must not be null");
        if (channels <= 0) {
            throw new IllegalArgumentException("channels must be > 0");
        }
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be > 0");
        }
        if (samples.length % channels != 0) {
            throw new IllegalArgumentException("samples length " + samples.length
                    + " is not a multiple of channels " + channels);
        }
    }

    /** Number of sample frames (one sample per channel). */
    public int frameCount() {
        return samples.length / channels;
    }

    /**
     * Decodes signed 16-bit little-endian PCM bytes into a frame.
     */
    public static AudioFrame fromPcm16le(byte[] pcm, int length, int channels, int sampleRate) {
        int sampleCount = length / 2;
        sampleCount -= sampleCount % channels;
        float[] out = new float[sampleCount];
        for (int i = 0; i < sampleCount; i++) {
            int lo = pcm[2 * i] & 0xFF;
            int hi = pcm[2 * i + 1];
            short value = (short) ((hi << 8) | lo);
            out[i] = value < 0 ? value / AudioFormat.INT16_NEGATIVE_SCALE : value / AudioFormat.INT16_POSITIVE_SCALE;
        }
        return new AudioFrame(out, channels, sampleRate);
    }
}
