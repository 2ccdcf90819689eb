package com.phillippitts.ambient.service.command.clarifier;

import com.phillippitts.ambient.exception.ClarificationException;
import com.phillippitts.ambient.service.command.PhraseTable;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Clarifier backed by a {@link CompletionClient}. The model is asked for a JSON object
 * {@code {"clarifiedIntent": "...", "actionSteps": ["..."], "confidence": 0.0}}; text around the
 * object is ignored.
 */
@Component
public class CompletionClarifier implements Clarifier {

    private final CompletionClient client;

    public CompletionClarifier(CompletionClient client) {
        this.client = Objects.requireNonNull(client);
    }

    @Override
    public ClarifierReply clarify(String command, String contextSummary) {
        String reply = client.complete(buildPrompt(command, contextSummary));
        if (reply == null || reply.isBlank()) {
            throw new ClarificationException("Empty completion");
        }
        return parse(reply);
    }

    static String buildPrompt(String command, String contextSummary) {
        StringBuilder sb = new StringBuilder();
        sb.append("You help a desktop assistant understand a spoken command.\n");
        if (contextSummary != null && !contextSummary.isBlank()) {
            sb.append("Current context: ").append(contextSummary).append('\n');
        }
        sb.append("Command: \"").append(command).append("\"\n");
        sb.append("Rewrite it as one or more simple commands the assistant understands, for example:\n");
        for (String example : PhraseTable.examples()) {
            sb.append("- ").append(example).append('\n');
        }
        sb.append("Reply with JSON only: {\"clarifiedIntent\": string, \"actionSteps\": [string], ")
                .append("\"confidence\": number between 0 and 1}");
        return sb.toString();
    }

    static ClarifierReply parse(String reply) {
        int start = reply.indexOf('{');
        int end = reply.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new ClarificationException("Completion contained no JSON object");
        }
        try {
            JSONObject json = new JSONObject(reply.substring(start, end + 1));
            JSONArray steps = json.optJSONArray("actionSteps");
            List<String> actionSteps = new ArrayList<>();
            if (steps != null) {
                for (int i = 0; i < steps.length(); i++) {
                    String step = steps.optString(i, "").trim();
                    if (!step.isEmpty()) {
                        actionSteps.add(step);
                    }
                }
            }
            if (actionSteps.isEmpty()) {
                throw new ClarificationException("Completion proposed no action steps");
            }
            return new ClarifierReply(json.optString("clarifiedIntent", "").trim(), actionSteps,
                    json.optDouble("confidence", 0.5));
        } catch (JSONException e) {
            throw new ClarificationException("Unparsable completion: " + e.getMessage(), e);
        }
    }
}
