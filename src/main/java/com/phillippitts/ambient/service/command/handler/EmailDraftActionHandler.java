package com.phillippitts.ambient.service.command.handler;

import com.phillippitts.ambient.domain.ActionResult;
import com.phillippitts.ambient.domain.FallbackDetails;
import com.phillippitts.ambient.domain.FallbackReason;
import com.phillippitts.ambient.domain.FallbackRequest;
import com.phillippitts.ambient.domain.Intent;
import com.phillippitts.ambient.domain.IntentCategory;
import com.phillippitts.ambient.exception.LaunchException;
import com.phillippitts.ambient.service.launch.ExternalLauncher;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Opens a draft in the default mail client through a {@code mailto:} URI.
 */
@Component
public class EmailDraftActionHandler extends AbstractUriActionHandler {

    static final String MAIL_CLIENT = "Mail client";

    public EmailDraftActionHandler(ExternalLauncher launcher) {
        super(launcher);
    }

    @Override
    public IntentCategory category() {
        return IntentCategory.EMAIL;
    }

    @Override
    public ActionResult run(Intent intent) {
        String recipient = orEmpty(intent.arg("recipient"));
        String subject = orEmpty(intent.arg("subject"));
        String body = orEmpty(intent.arg("body"));

        String uri = mailto(recipient, subject, body);
        List<String> nextSteps = new ArrayList<>();
        nextSteps.add(recipient.isEmpty() ? "Add a recipient" : "Review the draft to " + recipient);
        nextSteps.add("Press send when ready");
        return openUri(uri, "Drafting email" + (recipient.isEmpty() ? "" : " to " + recipient), nextSteps, "email");
    }

    @Override
    protected ActionResult onLaunchFailure(String actionName, LaunchException e) {
        return ActionResult.needsFallback("No mail client available",
                new FallbackRequest(FallbackReason.MISSING_APP, "draft an email",
                        FallbackDetails.forApp(MAIL_CLIENT, null)));
    }

    static String mailto(String recipient, String subject, String body) {
        StringBuilder sb = new StringBuilder("mailto:").append(recipient);
        String sep = "?";
        if (!subject.isEmpty()) {
            sb.append(sep).append("subject=").append(encode(subject));
            sep = "&";
        }
        if (!body.isEmpty()) {
            sb.append(sep).append("body=").append(encode(body));
        }
        return sb.toString();
    }

    private static String orEmpty(String s) {
        return s == null ? "" : s.trim();
    }
}
