package com.phillippitts.recorderbridge.presentation.controller;

import com.phillippitts.recorderbridge.service.recorder.DeviceInfo;
import com.phillippitts.recorderbridge.service.recorder.RecorderService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * HTTP binding of {@link RecorderService}. Failures are rendered by {@code GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/recorder")
class RecorderController {

    private final RecorderService recorder;

    RecorderController(RecorderService recorder) {
        this.recorder = recorder;
    }

    @GetMapping("/devices")
    List<DeviceInfo> devices() {
        return recorder.enumerateRecordingDevices();
    }

    @PostMapping("/session")
    ResponseEntity<Void> initSession(@Valid @RequestBody InitSessionRequest request) {
        recorder.initRecordingSession(request.deviceName());
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/session")
    ResponseEntity<Void> closeSession() {
        recorder.closeRecordingSession();
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/recording/start")
    ResponseEntity<Void> startRecording() {
        recorder.startRecording();
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/recording/stop")
    float[] stopRecording() {
        return recorder.stopRecording();
    }

    @PostMapping("/recording/cancel")
    ResponseEntity<Void> cancelRecording() {
        recorder.cancelRecording();
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/status")
    RecorderStatus status() {
        return new RecorderStatus(recorder.isRecording(), recorder.isWorkerRunning());
    }

    @DeleteMapping("/worker")
    ResponseEntity<Void> closeWorker() {
        recorder.closeWorker();
        return ResponseEntity.noContent().build();
    }

    record InitSessionRequest(@NotNull String deviceName) { }

    record RecorderStatus(boolean recording, boolean workerRunning) { }
}
