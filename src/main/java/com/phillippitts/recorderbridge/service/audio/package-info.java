/**
 * Audio format constants and capture.
 *
 * <p>Captured audio is 16-bit signed PCM, mono, little-endian, at
 * {@code audio.capture.sample-rate} (16 kHz by default), and is handed to callers as floats
 * in [-1, 1).
 *
 * @see com.phillippitts.recorderbridge.service.audio.AudioFormat
 * @see com.phillippitts.recorderbridge.service.audio.capture.JavaSoundRecorderBackend
 * @since 1.0
 */
package com.phillippitts.recorderbridge.service.audio;
