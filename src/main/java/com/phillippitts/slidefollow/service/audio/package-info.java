/**
 * Audio capture and wire encoding.
 *
 * <p>Capture produces {@link com.phillippitts.slidefollow.service.audio.AudioFrame}s on a dedicated
 * thread; {@link com.phillippitts.slidefollow.service.audio.PcmFrameEncoder} turns them into the
 * 16 kHz mono int16 stream defined by {@link com.phillippitts.slidefollow.service.audio.AudioFormat}.
 */
package com.phillippitts.slidefollow.service.audio;
