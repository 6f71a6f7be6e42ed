package com.phillippitts.recorderbridge.service.recorder;

import com.phillippitts.recorderbridge.exception.RecorderException;
import com.phillippitts.recorderbridge.service.worker.RecorderCommand;
import com.phillippitts.recorderbridge.service.worker.RecorderResponse;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;

/**
 * Default {@link RecorderService}, built on {@link CommandDispatcher}.
 *
 * <p>{@link RecordingState} is only changed inside a successful round trip; error responses
 * leave it untouched.
 */
@Service
public class DefaultRecorderService implements RecorderService {

    private static final Logger LOG = LogManager.getLogger(DefaultRecorderService.class);

    private final CommandDispatcher dispatcher;
    private final WorkerRegistry registry;
    private final RecordingState state;

    public DefaultRecorderService(CommandDispatcher dispatcher,
                                  WorkerRegistry registry,
                                  RecordingState state) {
        this.dispatcher = Objects.requireNonNull(dispatcher);
        this.registry = Objects.requireNonNull(registry);
        this.state = Objects.requireNonNull(state);
    }

    @Override
    public List<DeviceInfo> enumerateRecordingDevices() {
        LOG.debug("Enumerating recording devices");
        List<DeviceInfo> devices = dispatcher.withWorker("enumerateRecordingDevices",
                new RecorderCommand.EnumerateRecordingDevices(),
                RecorderResponse.RecordingDeviceList.class,
                list -> list.devices().stream().map(DeviceInfo::fromLabel).toList());
        LOG.info("Found {} recording devices", devices.size());
        return devices;
    }

    @Override
    public void initRecordingSession(String deviceName) {
        if (deviceName == null) {
            throw RecorderException.audioError("device name is required");
        }
        LOG.info("Initializing recording session on device '{}'", deviceName);
        dispatcher.withWorker("initRecordingSession",
                new RecorderCommand.InitRecordingSession(deviceName),
                RecorderResponse.Success.class,
                ok -> null);
        LOG.info("Recording session initialized successfully");
    }

    @Override
    public void closeRecordingSession() {
        dispatcher.withWorker("closeRecordingSession",
                new RecorderCommand.CloseRecordingSession(),
                RecorderResponse.Success.class,
                ok -> {
                    state.markStopped();
                    return null;
                });
        LOG.info("Recording session closed");
    }

    @Override
    public void startRecording() {
        dispatcher.withWorker("startRecording",
                new RecorderCommand.StartRecording(),
                RecorderResponse.Success.class,
                ok -> {
                    state.markRecording();
                    return null;
                });
        LOG.info("Recording started");
    }

    @Override
    public float[] stopRecording() {
        LOG.debug("Stopping recording");
        float[] samples = dispatcher.withWorker("stopRecording",
                new RecorderCommand.StopRecording(),
                RecorderResponse.AudioData.class,
                data -> {
                    state.markStopped();
                    return data.samples();
                });
        LOG.info("Recording stopped successfully ({} samples)", samples.length);
        return samples;
    }

    @Override
    public void cancelRecording() {
        LOG.debug("Canceling recording");
        dispatcher.withWorker("cancelRecording",
                new RecorderCommand.StopRecording(),
                RecorderResponse.AudioData.class,
                data -> {
                    state.markStopped();
                    return null;
                });
        LOG.info("Recording canceled successfully");
    }

    @Override
    public void closeWorker() {
        registry.teardown(state::markStopped);
    }

    @Override
    public boolean isRecording() {
        return state.isRecording();
    }

    @Override
    public boolean isWorkerRunning() {
        return registry.isInitialized();
    }

    @PreDestroy
    public void shutdown() {
        try {
            closeWorker();
        } catch (RecorderException e) {
            LOG.warn("Audio worker did not close cleanly on shutdown: {}", e.getMessage());
        }
    }
}
