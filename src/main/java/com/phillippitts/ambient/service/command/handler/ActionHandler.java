package com.phillippitts.ambient.service.command.handler;

import com.phillippitts.ambient.domain.ActionResult;
import com.phillippitts.ambient.domain.Intent;
import com.phillippitts.ambient.domain.IntentCategory;

/**
 * Executes intents of one category. Exactly one handler bean exists per executable category.
 *
 * <p>Handlers do not throw for expected failures; they return a failed {@link ActionResult},
 * attaching a fallback request when recovery guidance applies.
 */
public interface ActionHandler {

    IntentCategory category();

    ActionResult run(Intent intent);
}
