package com.phillippitts.recorderbridge.service.audio.capture;

import com.phillippitts.recorderbridge.config.properties.AudioCaptureProperties;
import com.phillippitts.recorderbridge.exception.AudioDeviceException;
import com.phillippitts.recorderbridge.service.audio.AudioFormat;
import com.phillippitts.recorderbridge.service.worker.RecorderBackend;
import com.phillippitts.recorderbridge.util.CaptureTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.Line;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.Mixer;
import javax.sound.sampled.TargetDataLine;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Java Sound based {@link RecorderBackend}. Captures PCM16LE mono and hands it back as floats.
 *
 * <p>A session owns an open {@link TargetDataLine} on the chosen mixer; the line stays open
 * between recordings so that back-to-back recordings on the same session start quickly. Each
 * recording runs a dedicated capture thread that drains the line into a {@link PcmRingBuffer}
 * sized for {@code audio.capture.max-duration-ms}.
 *
 * <p>Confined to the audio worker thread; only the capture loop runs elsewhere, and it shares
 * nothing but the ring buffer and its {@code active} flag.
 */
public class JavaSoundRecorderBackend implements RecorderBackend {

    private static final Logger LOG = LogManager.getLogger(JavaSoundRecorderBackend.class);

    /** Device name that selects the system default line. */
    public static final String DEFAULT_DEVICE = "default";

    /** Abstraction to open a TargetDataLine (for testing). */
    public interface DataLineProvider {
        TargetDataLine open(javax.sound.sampled.AudioFormat format, Optional<String> deviceName)
                throws LineUnavailableException;
    }

    /** Abstraction over mixer enumeration (for testing). */
    public interface DeviceEnumerator {
        List<String> captureDeviceNames();
    }

    private final AudioCaptureProperties props;
    private final DeviceEnumerator enumerator;
    private final DataLineProvider provider;
    private final javax.sound.sampled.AudioFormat format;

    private Session session;
    private Capture capture;

    public JavaSoundRecorderBackend(AudioCaptureProperties props) {
        this(props, JavaSoundRecorderBackend::systemCaptureDevices, JavaSoundRecorderBackend::openSystemLine);
    }

    // Package-private for tests
    JavaSoundRecorderBackend(AudioCaptureProperties props,
                             DeviceEnumerator enumerator,
                             DataLineProvider provider) {
        this.props = Objects.requireNonNull(props);
        this.enumerator = Objects.requireNonNull(enumerator);
        this.provider = Objects.requireNonNull(provider);
        this.format = AudioFormat.javaSoundFormat(props.getSampleRate());
    }

    @Override
    public List<String> listDevices() {
        List<String> devices = enumerator.captureDeviceNames();
        LOG.debug("Enumerated {} capture devices", devices.size());
        return devices;
    }

    @Override
    public void openSession(String deviceName) {
        if (capture != null) {
            throw new IllegalStateException("Cannot initialize a session while recording");
        }
        Optional<String> device = normalize(deviceName);
        String label = device.orElse(DEFAULT_DEVICE);
        closeLine();

        TargetDataLine line;
        try {
            line = provider.open(format, device);
        } catch (LineUnavailableException e) {
            throw new AudioDeviceException(label, e.getMessage(), e);
        } catch (SecurityException e) {
            throw new AudioDeviceException(label, "microphone access denied", e);
        } catch (IllegalArgumentException e) {
            throw new AudioDeviceException(label, "format not supported", e);
        }
        session = new Session(label, line);
        LOG.info("Recording session opened on device '{}' ({} Hz)", label, props.getSampleRate());
    }

    @Override
    public void closeSession() {
        if (capture != null) {
            LOG.info("Closing session with active recording; captured audio discarded");
            endCapture(CaptureTimeouts.CAPTURE_THREAD_SHUTDOWN_TIMEOUT);
        }
        if (session != null) {
            LOG.info("Recording session on device '{}' closed", session.deviceName);
        }
        closeLine();
    }

    @Override
    public void startRecording() {
        if (session == null) {
            throw new IllegalStateException("No active recording session");
        }
        if (capture != null) {
            throw new IllegalStateException("Recording already in progress");
        }
        int byteRate = AudioFormat.byteRate(props.getSampleRate());
        int bytesPerChunk = Math.max(AudioFormat.BLOCK_ALIGN,
                (props.getChunkMillis() * byteRate) / 1000 / AudioFormat.BLOCK_ALIGN * AudioFormat.BLOCK_ALIGN);
        long capacity = ((long) props.getMaxDurationMs() * byteRate) / 1000L;

        Capture c = new Capture(new PcmRingBuffer((int) Math.min(capacity, Integer.MAX_VALUE - 8)));
        TargetDataLine line = session.line;
        line.flush();
        line.start();
        c.active.set(true);

        Thread t = new Thread(() -> doCapture(c, line, bytesPerChunk), "audio-capture");
        t.setDaemon(true);
        c.thread = t;
        capture = c;
        t.start();
        LOG.info("Recording started on device '{}'", session.deviceName);
    }

    @Override
    public float[] stopRecording() {
        if (capture == null) {
            throw new IllegalStateException("No active recording");
        }
        Capture c = endCapture(CaptureTimeouts.CAPTURE_THREAD_STOP_TIMEOUT);
        if (c.failure != null) {
            throw new IllegalStateException("Capture failed: " + c.failure.getMessage(), c.failure);
        }
        byte[] pcm = c.buffer.toByteArray();
        if (c.buffer.droppedBytes() > 0) {
            LOG.info("Recording exceeded {} ms; {} oldest bytes dropped",
                    props.getMaxDurationMs(), c.buffer.droppedBytes());
        }
        float[] samples = PcmConverter.toFloatSamples(pcm);
        LOG.info("Recording stopped: {} samples", samples.length);
        return samples;
    }

    @Override
    public void close() {
        closeSession();
    }

    private void doCapture(Capture c, TargetDataLine line, int bytesPerChunk) {
        byte[] buf = new byte[bytesPerChunk];
        long written = 0;
        try {
            while (c.active.get()) {
                int n = line.read(buf, 0, buf.length);
                if (n <= 0) {
                    if (!line.isOpen()) {
                        throw new IllegalStateException("capture line closed unexpectedly");
                    }
                    Thread.sleep(CaptureTimeouts.EMPTY_READ_BACKOFF.toMillis());
                    continue;
                }
                c.buffer.write(buf, 0, n);
                written += n;
            }
            LOG.debug("Audio capture completed: total {} bytes captured", written);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.debug("Capture thread interrupted after {} bytes", written);
        } catch (RuntimeException e) {
            LOG.warn("Capture failed after {} bytes: {}", written, e.toString());
            c.failure = e;
        }
    }

    private Capture endCapture(Duration timeout) {
        Capture c = capture;
        capture = null;
        c.active.set(false);
        joinThread(c.thread, timeout.toMillis());
        if (session != null) {
            try {
                session.line.stop();
                session.line.flush();
            } catch (RuntimeException e) {
                LOG.warn("Failed to stop line on device '{}': {}", session.deviceName, e.toString());
            }
        }
        return c;
    }

    private void closeLine() {
        if (session == null) {
            return;
        }
        Session s = session;
        session = null;
        try {
            s.line.close();
        } catch (RuntimeException e) {
            LOG.warn("Failed to close line on device '{}': {}", s.deviceName, e.toString());
        }
    }

    private static void joinThread(Thread thread, long timeoutMs) {
        if (thread == null || !thread.isAlive()) {
            return;
        }
        try {
            thread.join(timeoutMs);
            if (thread.isAlive()) {
                LOG.warn("Capture thread did not terminate within {}ms", timeoutMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for capture thread to terminate");
        }
    }

    private static Optional<String> normalize(String deviceName) {
        if (deviceName == null || deviceName.isBlank() || DEFAULT_DEVICE.equalsIgnoreCase(deviceName.trim())) {
            return Optional.empty();
        }
        return Optional.of(deviceName.trim());
    }

    static List<String> systemCaptureDevices() {
        Line.Info target = new Line.Info(TargetDataLine.class);
        List<String> names = new ArrayList<>();
        for (Mixer.Info info : AudioSystem.getMixerInfo()) {
            if (AudioSystem.getMixer(info).isLineSupported(target)) {
                names.add(info.getName());
            }
        }
        return names;
    }

    static TargetDataLine openSystemLine(javax.sound.sampled.AudioFormat format, Optional<String> device)
            throws LineUnavailableException {
        DataLine.Info lineInfo = new DataLine.Info(TargetDataLine.class, format);
        TargetDataLine line = null;
        if (device.isPresent()) {
            for (Mixer.Info info : AudioSystem.getMixerInfo()) {
                if (info.getName().equalsIgnoreCase(device.get())) {
                    line = (TargetDataLine) AudioSystem.getMixer(info).getLine(lineInfo);
                    break;
                }
            }
            if (line == null) {
                throw new LineUnavailableException("No capture device named '" + device.get() + "'");
            }
        } else {
            line = (TargetDataLine) AudioSystem.getLine(lineInfo);
        }
        line.open(format);
        return line;
    }

    private static final class Session {
        final String deviceName;
        final TargetDataLine line;

        Session(String deviceName, TargetDataLine line) {
            this.deviceName = deviceName;
            this.line = line;
        }
    }

    private static final class Capture {
        final AtomicBoolean active = new AtomicBoolean(false);
        final PcmRingBuffer buffer;
        volatile Thread thread;
        volatile RuntimeException failure;

        Capture(PcmRingBuffer buffer) {
            this.buffer = buffer;
        }
    }
}
