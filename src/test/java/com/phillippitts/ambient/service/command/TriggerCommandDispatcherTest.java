package com.phillippitts.ambient.service.command;

import com.phillippitts.ambient.domain.RoutingOutcome;
import com.phillippitts.ambient.domain.Trigger;
import com.phillippitts.ambient.service.context.event.ContextTriggerEvent;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TriggerCommandDispatcherTest {

    @Test
    void shouldExecuteEveryTriggerActionInOrder() {
        CommandService commands = mock(CommandService.class);
        when(commands.executeTriggerAction(anyString())).thenReturn(
                new CommandResponse(true, "ok", null, null, RoutingOutcome.READY, null, null, List.of()));
        TriggerCommandDispatcher dispatcher = new TriggerCommandDispatcher(commands);
        Trigger trigger = new Trigger("email-help", List.of("open mail", "search for email etiquette"),
                UUID.randomUUID(), Instant.now());

        dispatcher.onTrigger(new ContextTriggerEvent(trigger));

        var order = inOrder(commands);
        order.verify(commands).executeTriggerAction("open mail");
        order.verify(commands).executeTriggerAction("search for email etiquette");
    }
}
