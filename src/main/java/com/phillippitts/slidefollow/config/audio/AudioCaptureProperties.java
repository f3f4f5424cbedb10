package com.phillippitts.slidefollow.config.audio;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for microphone capture.
 *
 * Capture happens at the device's native rate and channel count; the encoder converts to the
 * 16 kHz mono stream format.
 */
@Validated
@ConfigurationProperties(prefix = "audio.capture")
public class AudioCaptureProperties {

    /** Size of a read chunk from the TargetDataLine in milliseconds. */
    @Min(10)
    @Max(500)
    private final int chunkMillis;

    /** Sample rate the input line is opened with, in Hz. */
    @Min(8_000)
    @Max(192_000)
    private final int sampleRate;

    /** Channel count the input line is opened with; downmixed to mono before streaming. */
    @Min(1)
    @Max(8)
    private final int channels;

    /** Optional input device name hint; falls back to system default when null/blank. */
    private final String deviceName;

    @ConstructorBinding
    public AudioCaptureProperties(@NotNull Integer chunkMillis,
                                  @NotNull Integer sampleRate,
                                  @NotNull Integer channels,
                                  String deviceName) {
        this.chunkMillis = chunkMillis;
        this.sampleRate = sampleRate;
        this.channels = channels;
        this.deviceName = (deviceName == null || deviceName.isBlank()) ? null : deviceName;
    }

    public int getChunkMillis() { return chunkMillis; }
    public int getSampleRate() { return sampleRate; }
    public int getChannels() { return channels; }
    public String getDeviceName() { return deviceName; }
}
