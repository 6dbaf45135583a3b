/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.streamscribe.exception.StreamScribeException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.streamscribe.exception.EngineInitException} - Engine could not be
 *       loaded; surfaced synchronously when the pipeline is opened</li>
 *   <li>{@link com.phillippitts.streamscribe.exception.TranscriptionException} - A single
 *       inference call failed; absorbed and logged by the inference worker</li>
 *   <li>{@link com.phillippitts.streamscribe.exception.InvalidAudioException} - A REST payload
 *       could not be decoded into samples</li>
 * </ul>
 *
 * <p>All exceptions are unchecked and map to HTTP status codes via {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.streamscribe.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.streamscribe.exception;
