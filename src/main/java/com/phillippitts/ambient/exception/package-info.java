/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.ambient.exception.AmbientException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.ambient.exception.ConfigurationValidationException} - Rejected
 *       filter or pattern registration; subclassed by
 *       {@link com.phillippitts.ambient.exception.InvalidFilterException} and
 *       {@link com.phillippitts.ambient.exception.InvalidPatternException}</li>
 *   <li>{@link com.phillippitts.ambient.exception.ExtractionException} - Foreground window probe
 *       or text extraction failed during a screen sampling tick</li>
 *   <li>{@link com.phillippitts.ambient.exception.TranscriptionException} - Speech-to-text backend
 *       failed for a window of audio</li>
 *   <li>{@link com.phillippitts.ambient.exception.ClarificationException} - Completion-backed
 *       clarifier failed or replied with an unusable payload</li>
 * </ul>
 *
 * <p>Sensing and clarification failures are recovered where they occur and never reach
 * callers of the command surface. Configuration failures map to HTTP 400 via
 * {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.ambient.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.ambient.exception;
