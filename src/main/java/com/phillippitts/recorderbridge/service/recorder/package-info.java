/**
 * Serialized access to the single audio worker.
 *
 * <p>{@link com.phillippitts.recorderbridge.service.recorder.WorkerRegistry} owns the worker's
 * channel pair and the lock, {@link com.phillippitts.recorderbridge.service.recorder.CommandDispatcher}
 * runs round trips under that lock, and
 * {@link com.phillippitts.recorderbridge.service.recorder.DefaultRecorderService} maps the
 * caller-facing operations onto commands and keeps
 * {@link com.phillippitts.recorderbridge.service.recorder.RecordingState} in step.
 */
package com.phillippitts.recorderbridge.service.recorder;
