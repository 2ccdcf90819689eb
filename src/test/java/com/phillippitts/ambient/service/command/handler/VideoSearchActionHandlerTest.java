package com.phillippitts.ambient.service.command.handler;

import com.phillippitts.ambient.domain.ActionResult;
import com.phillippitts.ambient.domain.Intent;
import com.phillippitts.ambient.domain.IntentCategory;
import com.phillippitts.ambient.domain.MatchStrategy;
import com.phillippitts.ambient.testutil.FakeExternalLauncher;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class VideoSearchActionHandlerTest {

    private final FakeExternalLauncher launcher = new FakeExternalLauncher();
    private final VideoSearchActionHandler handler = new VideoSearchActionHandler(launcher);

    @Test
    void shouldOpenYoutubeResults() {
        ActionResult result = handler.run(intent(Map.of("query", "jazz piano")));

        assertThat(result.success()).isTrue();
        assertThat(launcher.openedUris())
                .containsExactly(VideoSearchActionHandler.YOUTUBE_RESULTS + "jazz%20piano");
    }

    @Test
    void emptyQueryOpensYoutubeHome() {
        handler.run(intent(Map.of()));

        assertThat(launcher.openedUris()).containsExactly(VideoSearchActionHandler.YOUTUBE_HOME);
    }

    private static Intent intent(Map<String, String> args) {
        return new Intent(IntentCategory.VIDEO, "videoSearch", 1.0, "play", args, MatchStrategy.EXACT);
    }
}
