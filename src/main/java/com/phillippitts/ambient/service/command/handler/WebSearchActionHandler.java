package com.phillippitts.ambient.service.command.handler;

import com.phillippitts.ambient.domain.ActionResult;
import com.phillippitts.ambient.domain.Intent;
import com.phillippitts.ambient.domain.IntentCategory;
import com.phillippitts.ambient.service.launch.ExternalLauncher;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class WebSearchActionHandler extends AbstractUriActionHandler {

    static final String SEARCH_URL = "https://www.google.com/search?q=";

    public WebSearchActionHandler(ExternalLauncher launcher) {
        super(launcher);
    }

    @Override
    public IntentCategory category() {
        return IntentCategory.SEARCH;
    }

    @Override
    public ActionResult run(Intent intent) {
        String query = intent.arg("query");
        if (query == null || query.isBlank()) {
            return ActionResult.failed("What should I search for?", List.of("Say \"search for\" followed by a topic"));
        }
        return openUri(SEARCH_URL + encode(query), "Searching the web for \"" + query + "\"",
                List.of("Open web search for \"" + query + "\""), "web search");
    }
}
