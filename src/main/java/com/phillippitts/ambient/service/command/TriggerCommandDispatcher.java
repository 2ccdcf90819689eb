package com.phillippitts.ambient.service.command;

import com.phillippitts.ambient.domain.Trigger;
import com.phillippitts.ambient.service.context.event.ContextTriggerEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Runs the actions of fired context patterns on the command executor, so sentinel threads
 * publishing the trigger never wait for command execution.
 */
@Component
public class TriggerCommandDispatcher {

    private static final Logger LOG = LogManager.getLogger(TriggerCommandDispatcher.class);

    private final CommandService commands;

    public TriggerCommandDispatcher(CommandService commands) {
        this.commands = Objects.requireNonNull(commands);
    }

    @Async("commandExecutor")
    @EventListener
    public void onTrigger(ContextTriggerEvent event) {
        dispatch(event.trigger());
    }

    void dispatch(Trigger trigger) {
        for (String action : trigger.triggerActions()) {
            CommandResponse response = commands.executeTriggerAction(action);
            LOG.info("Trigger '{}' action '{}': success={}", trigger.patternName(), action, response.success());
        }
    }
}
