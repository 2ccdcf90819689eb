package com.phillippitts.ambient.service.command;

import com.phillippitts.ambient.config.properties.CommandProperties;
import com.phillippitts.ambient.domain.Clarification;
import com.phillippitts.ambient.domain.ContextSnapshot;
import com.phillippitts.ambient.domain.Intent;
import com.phillippitts.ambient.domain.IntentCategory;
import com.phillippitts.ambient.domain.MatchStrategy;
import com.phillippitts.ambient.domain.RoutingOutcome;
import com.phillippitts.ambient.service.command.clarifier.Clarifier;
import com.phillippitts.ambient.service.command.clarifier.ClarifierReply;
import com.phillippitts.ambient.service.context.ContextEngine;
import com.phillippitts.ambient.service.metrics.AmbientMetrics;
import com.phillippitts.ambient.util.LogSanitizer;
import com.phillippitts.ambient.util.TextSimilarity;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Maps free-text commands to intents.
 *
 * <p>Strategies run in a fixed order and the first hit wins:
 * <ol>
 *   <li>exact: the command equals or starts with a trigger phrase (longest phrase wins), confidence 1.0</li>
 *   <li>fuzzy: a synonym for the first word, or a first word within edit distance of a
 *       single-word phrase; confidence always below 1.0</li>
 *   <li>clarifier: the command and a context summary go to the {@link Clarifier}; its proposal
 *       is parked in {@link PendingConfirmations} until the user confirms it</li>
 * </ol>
 */
@Service
public class CommandRouter {

    private static final Logger LOG = LogManager.getLogger(CommandRouter.class);

    static final double SYNONYM_CONFIDENCE = 0.85;
    static final double FUZZY_SCALE = 0.9;
    private static final int MIN_FUZZY_TOKEN_LENGTH = 3;

    private final ArgumentExtractor extractor;
    private final Clarifier clarifier;
    private final PendingConfirmations confirmations;
    private final ContextEngine contextEngine;
    private final CommandProperties props;
    private final AmbientMetrics metrics;
    private final Executor clarifierExecutor;

    public CommandRouter(AppCatalog catalog,
                         Clarifier clarifier,
                         PendingConfirmations confirmations,
                         ContextEngine contextEngine,
                         CommandProperties props,
                         AmbientMetrics metrics,
                         @Qualifier("clarifierExecutor") Executor clarifierExecutor) {
        this.extractor = new ArgumentExtractor(catalog);
        this.clarifier = Objects.requireNonNull(clarifier);
        this.confirmations = Objects.requireNonNull(confirmations);
        this.contextEngine = Objects.requireNonNull(contextEngine);
        this.props = Objects.requireNonNull(props);
        this.metrics = Objects.requireNonNull(metrics);
        this.clarifierExecutor = Objects.requireNonNull(clarifierExecutor);
    }

    /**
     * Routes a command through all three strategies.
     */
    public RoutingDecision route(String rawCommand, String sessionId) {
        Optional<Intent> local = matchLocally(rawCommand);
        if (local.isPresent()) {
            return RoutingDecision.ready(local.get());
        }
        String normalized = normalize(rawCommand);
        if (normalized.isEmpty()) {
            return RoutingDecision.unresolved(rawCommand);
        }
        return clarify(rawCommand, normalized, sessionId);
    }

    /**
     * Routes with exact and fuzzy matching only. Used for confirmed clarification steps and
     * trigger actions, which must never loop back into the clarifier.
     */
    public RoutingDecision routeLocally(String rawCommand) {
        return matchLocally(rawCommand).map(RoutingDecision::ready)
                .orElseGet(() -> RoutingDecision.unresolved(rawCommand));
    }

    static String normalize(String raw) {
        return collapse(raw).toLowerCase(Locale.ROOT);
    }

    /** Trims and collapses whitespace, keeping the original case for argument values. */
    static String collapse(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.trim().replaceAll("\\s+", " ");
    }

    private Optional<Intent> matchLocally(String rawCommand) {
        String normalized = normalize(rawCommand);
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        String collapsed = collapse(rawCommand);
        // lower-casing can change the length of a few non-ASCII strings; offsets then come from the folded copy
        String source = collapsed.length() == normalized.length() ? collapsed : normalized;
        Optional<Intent> exact = matchExact(rawCommand, normalized, source);
        if (exact.isPresent()) {
            return exact;
        }
        return matchFuzzy(rawCommand, normalized, source);
    }

    private Optional<Intent> matchExact(String raw, String normalized, String source) {
        return PhraseTable.longestPrefix(normalized).map(m -> {
            String remainder = source.substring(m.phrase().length()).trim();
            ArgumentExtractor.Extraction ext = extractor.extract(m.category(), m.phrase(), remainder);
            return new Intent(m.category(), functionName(m.category(), ext.args()), 1.0, raw,
                    ext.args(), MatchStrategy.EXACT);
        });
    }

    private Optional<Intent> matchFuzzy(String raw, String normalized, String source) {
        int space = normalized.indexOf(' ');
        String first = space < 0 ? normalized : normalized.substring(0, space);
        String remainder = space < 0 ? "" : source.substring(space + 1);

        Optional<IntentCategory> synonym = PhraseTable.synonym(first);
        if (synonym.isPresent()) {
            return Optional.of(fuzzyIntent(raw, synonym.get(), first, remainder, SYNONYM_CONFIDENCE));
        }
        if (first.length() < MIN_FUZZY_TOKEN_LENGTH) {
            return Optional.empty();
        }
        PhraseTable.PhraseMatch best = null;
        double bestScore = 0.0;
        for (PhraseTable.PhraseMatch candidate : PhraseTable.singleWordPhrases()) {
            double score = TextSimilarity.similarity(first, candidate.phrase());
            if (score > bestScore) {
                bestScore = score;
                best = candidate;
            }
        }
        if (best == null || bestScore < props.getFuzzyThreshold()) {
            return Optional.empty();
        }
        LOG.debug("Fuzzy match: '{}' ~ '{}' ({})", first, best.phrase(), bestScore);
        return Optional.of(fuzzyIntent(raw, best.category(), best.phrase(), remainder, FUZZY_SCALE * bestScore));
    }

    private Intent fuzzyIntent(String raw, IntentCategory category, String phrase, String remainder, double base) {
        ArgumentExtractor.Extraction ext = extractor.extract(category, phrase, remainder);
        double confidence = Math.min(base * ext.quality(), 0.99);
        return new Intent(category, functionName(category, ext.args()), confidence, raw, ext.args(),
                MatchStrategy.FUZZY);
    }

    private RoutingDecision clarify(String raw, String normalized, String sessionId) {
        String summary = contextSummary();
        CompletableFuture<ClarifierReply> future =
                CompletableFuture.supplyAsync(() -> clarifier.clarify(normalized, summary), clarifierExecutor);
        ClarifierReply reply;
        try {
            reply = future.get(props.getClarifierTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            metrics.recordClarifier("timeout");
            LOG.info("Clarifier timed out after {}ms", props.getClarifierTimeoutMs());
            return RoutingDecision.unresolved(raw);
        } catch (ExecutionException e) {
            metrics.recordClarifier("failed");
            LOG.info("Clarifier failed: {}", e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            return RoutingDecision.unresolved(raw);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            metrics.recordClarifier("failed");
            return RoutingDecision.unresolved(raw);
        }
        if (reply == null || reply.actionSteps().isEmpty()) {
            metrics.recordClarifier("empty");
            return RoutingDecision.unresolved(raw);
        }
        metrics.recordClarifier("proposed");
        Clarification clarification = confirmations.register(sessionId, reply);
        LOG.info("Clarification proposed: requestId={}, steps={}, intent='{}'", clarification.requestId(),
                reply.actionSteps().size(), LogSanitizer.preview(reply.clarifiedIntent()));
        Intent intent = new Intent(IntentCategory.UNKNOWN, "clarify", reply.confidence(), raw, Map.of(),
                MatchStrategy.CLARIFIER);
        return new RoutingDecision(intent, RoutingOutcome.NEEDS_CONFIRMATION, clarification);
    }

    private String contextSummary() {
        Optional<ContextSnapshot> current = contextEngine.currentSnapshot();
        if (current.isEmpty()) {
            return "";
        }
        ContextSnapshot s = current.get();
        StringBuilder sb = new StringBuilder();
        sb.append("app=").append(s.appName() == null ? "" : s.appName());
        sb.append("; title=").append(LogSanitizer.truncate(s.windowTitle(), 80));
        if (s.userIntent() != null) {
            sb.append("; activity=").append(s.userIntent().type());
        }
        return sb.toString();
    }

    static String functionName(IntentCategory category, Map<String, String> args) {
        return switch (category) {
            case OPEN -> args.containsKey("url") ? "openUrl" : "openApp";
            case SEARCH -> "webSearch";
            case EMAIL -> "draftEmail";
            case VIDEO -> "videoSearch";
            case HELP -> "showHelp";
            case UNKNOWN -> "none";
        };
    }
}
