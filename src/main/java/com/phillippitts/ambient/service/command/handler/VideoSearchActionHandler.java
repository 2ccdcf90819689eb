package com.phillippitts.ambient.service.command.handler;

import com.phillippitts.ambient.domain.ActionResult;
import com.phillippitts.ambient.domain.Intent;
import com.phillippitts.ambient.domain.IntentCategory;
import com.phillippitts.ambient.service.launch.ExternalLauncher;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class VideoSearchActionHandler extends AbstractUriActionHandler {

    static final String YOUTUBE_HOME = "https://www.youtube.com";
    static final String YOUTUBE_RESULTS = "https://www.youtube.com/results?search_query=";

    public VideoSearchActionHandler(ExternalLauncher launcher) {
        super(launcher);
    }

    @Override
    public IntentCategory category() {
        return IntentCategory.VIDEO;
    }

    @Override
    public ActionResult run(Intent intent) {
        String query = intent.arg("query");
        if (query == null || query.isBlank()) {
            return openUri(YOUTUBE_HOME, "Opening YouTube", List.of("Open YouTube"), "video search");
        }
        return openUri(YOUTUBE_RESULTS + encode(query), "Searching YouTube for \"" + query + "\"",
                List.of("Open YouTube results for \"" + query + "\""), "video search");
    }
}
