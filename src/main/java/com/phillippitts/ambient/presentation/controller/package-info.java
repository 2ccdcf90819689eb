/**
 * REST controllers for the assistant's HTTP surface.
 *
 * <ul>
 *   <li>{@link com.phillippitts.ambient.presentation.controller.CommandController}
 *       ({@code /api/commands}) - execute, confirm, suggestions, history</li>
 *   <li>{@link com.phillippitts.ambient.presentation.controller.PerceptionController}
 *       ({@code /api/perception}, {@code /api/filters}) - sentinel control, filters, captured records</li>
 *   <li>{@link com.phillippitts.ambient.presentation.controller.ContextController}
 *       ({@code /api/context}) - patterns, quiet hours, snapshots</li>
 *   <li>{@link com.phillippitts.ambient.presentation.controller.FallbackController}
 *       ({@code /api/fallback})</li>
 * </ul>
 *
 * <p>Controllers delegate to services and let {@code GlobalExceptionHandler} map exceptions.
 */
package com.phillippitts.ambient.presentation.controller;
