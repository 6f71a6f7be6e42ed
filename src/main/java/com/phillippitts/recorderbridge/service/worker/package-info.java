/**
 * The audio worker and the channel protocol used to talk to it.
 *
 * <p>{@link com.phillippitts.recorderbridge.service.worker.RecorderCommand} and
 * {@link com.phillippitts.recorderbridge.service.worker.RecorderResponse} are the only wire format
 * of the application and must stay stable. Everything device-specific sits behind
 * {@link com.phillippitts.recorderbridge.service.worker.RecorderBackend}.
 */
package com.phillippitts.recorderbridge.service.worker;
