package com.phillippitts.ambient.service.command.handler;

import com.phillippitts.ambient.domain.ActionResult;
import com.phillippitts.ambient.domain.Intent;
import com.phillippitts.ambient.domain.IntentCategory;
import com.phillippitts.ambient.service.command.PhraseTable;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class HelpActionHandler implements ActionHandler {

    @Override
    public IntentCategory category() {
        return IntentCategory.HELP;
    }

    @Override
    public ActionResult run(Intent intent) {
        return ActionResult.ok("I can open apps and websites, search the web and YouTube, and draft emails",
                PhraseTable.examples().stream().map(e -> "Try \"" + e + "\"").toList(), Map.of());
    }
}
