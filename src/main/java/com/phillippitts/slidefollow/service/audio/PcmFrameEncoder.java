package com.phillippitts.slidefollow.service.audio;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Converts captured frames into the recognition wire format: mono, resampled to the target rate,
 * quantized to signed 16-bit little-endian PCM.
 *
 * <p>Resampling is linear interpolation. The interpolation phase and the last input sample are
 * carried between calls so consecutive frames join without clicks; one encoder therefore belongs
 * to exactly one capture stream and is not thread-safe.
 */
public final class PcmFrameEncoder {

    private final int targetSampleRate;

    private double phase;
    private float lastSample;

    public PcmFrameEncoder(int targetSampleRate) {
        if (targetSampleRate <= 0) {
            throw new IllegalArgumentException("targetSampleRate must be > 0");
        }
        this.targetSampleRate = targetSampleRate;
    }

    /**
     * Encodes one frame.
     *
     * @return little-endian int16 samples, positioned at 0; empty for an empty frame
     */
    public ByteBuffer encode(AudioFrame frame) {
        float[] mono = downmix(frame);
        float[] resampled = frame.sampleRate() == targetSampleRate ? mono : resample(mono, frame.sampleRate());
        return quantize(resampled);
    }

    static float[] downmix(AudioFrame frame) {
        int channels = frame.channels();
        float[] in = frame.samples();
        if (channels == 1) {
            return in;
        }
        float[] out = new float[frame.frameCount()];
        for (int i = 0; i < out.length; i++) {
            float sum = 0f;
            for (int c = 0; c < channels; c++) {
                sum += in[i * channels + c];
            }
            out[i] = sum / channels;
        }
        return out;
    }

    float[] resample(float[] in, int sourceRate) {
        if (in.length == 0) {
            return in;
        }
        double step = (double) sourceRate / targetSampleRate;
        int capacity = (int) Math.ceil((in.length - phase) / step) + 1;
        float[] out = new float[Math.max(capacity, 0)];
        int n = 0;
        double pos = phase;
        // pos in [-1, 0) interpolates from the previous frame's last sample
        while (pos <= in.length - 1 && n < out.length) {
            int idx = (int) Math.floor(pos);
            double frac = pos - idx;
            float s0 = idx < 0 ? lastSample : in[idx];
            float s1 = idx + 1 < in.length ? in[idx + 1] : in[idx];
            out[n++] = (float) (s0 + (s1 - s0) * frac);
            pos += step;
        }
        phase = pos - in.length;
        lastSample = in[in.length - 1];
        if (n == out.length) {
            return out;
        }
        float[] trimmed = new float[n];
        System.arraycopy(out, 0, trimmed, 0, n);
        return trimmed;
    }

    static ByteBuffer quantize(float[] samples) {
        ByteBuffer buf = ByteBuffer.allocate(samples.length * AudioFormat.STREAM_BYTES_PER_SAMPLE)
                .order(ByteOrder.LITTLE_ENDIAN);
        for (float sample : samples) {
            float s = Math.max(-1f, Math.min(1f, sample));
            buf.putShort((short) (s < 0 ? s * AudioFormat.INT16_NEGATIVE_SCALE : s * AudioFormat.INT16_POSITIVE_SCALE));
        }
        buf.flip();
        return buf;
    }
}
