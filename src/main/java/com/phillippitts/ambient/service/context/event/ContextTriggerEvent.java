package com.phillippitts.ambient.service.context.event;

import com.phillippitts.ambient.domain.Trigger;

/**
 * Published once per firing pattern after a context update.
 */
public record ContextTriggerEvent(Trigger trigger) { }
