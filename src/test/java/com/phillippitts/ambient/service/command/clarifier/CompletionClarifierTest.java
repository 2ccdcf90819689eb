package com.phillippitts.ambient.service.command.clarifier;

import com.phillippitts.ambient.exception.ClarificationException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CompletionClarifierTest {

    @Test
    void shouldParseJsonSurroundedByProse() {
        String completion = "Sure! Here you go:\n"
                + "{\"clarifiedIntent\": \"Listen to music\", \"actionSteps\": [\"open spotify\", \" \"], "
                + "\"confidence\": 0.7}\nLet me know.";

        ClarifierReply reply = new CompletionClarifier(prompt -> completion).clarify("i want music", "");

        assertThat(reply.clarifiedIntent()).isEqualTo("Listen to music");
        assertThat(reply.actionSteps()).containsExactly("open spotify");
        assertThat(reply.confidence()).isEqualTo(0.7);
    }

    @Test
    void shouldClampConfidence() {
        ClarifierReply reply = CompletionClarifier.parse(
                "{\"clarifiedIntent\": \"x\", \"actionSteps\": [\"help\"], \"confidence\": 7}");

        assertThat(reply.confidence()).isEqualTo(1.0);
    }

    @Test
    void shouldIncludeCommandContextAndExamplesInPrompt() {
        AtomicReference<String> prompt = new AtomicReference<>();
        CompletionClarifier clarifier = new CompletionClarifier(p -> {
            prompt.set(p);
            return "{\"actionSteps\": [\"help\"]}";
        });

        clarifier.clarify("do the thing", "app=Chrome; title=Inbox");

        assertThat(prompt.get())
                .contains("Command: \"do the thing\"")
                .contains("Current context: app=Chrome; title=Inbox")
                .contains("search for react tutorial");
    }

    @Test
    void shouldRejectCompletionsWithoutUsableSteps() {
        assertThatThrownBy(() -> CompletionClarifier.parse("I don't know"))
                .isInstanceOf(ClarificationException.class)
                .hasMessageContaining("no JSON");
        assertThatThrownBy(() -> CompletionClarifier.parse("{\"clarifiedIntent\": \"x\", \"actionSteps\": []}"))
                .isInstanceOf(ClarificationException.class)
                .hasMessageContaining("no action steps");
        assertThatThrownBy(() -> CompletionClarifier.parse("{not json}"))
                .isInstanceOf(ClarificationException.class)
                .hasMessageContaining("Unparsable");
        assertThatThrownBy(() -> new CompletionClarifier(p -> " ").clarify("x", ""))
                .isInstanceOf(ClarificationException.class);
    }
}
