package com.phillippitts.ambient.service.command;

import com.phillippitts.ambient.domain.ActionResult;
import com.phillippitts.ambient.domain.Clarification;
import com.phillippitts.ambient.domain.CommandHistoryEntry;
import com.phillippitts.ambient.domain.FallbackDetails;
import com.phillippitts.ambient.domain.FallbackReason;
import com.phillippitts.ambient.domain.FallbackRequest;
import com.phillippitts.ambient.domain.FallbackResponse;
import com.phillippitts.ambient.domain.Intent;
import com.phillippitts.ambient.domain.IntentCategory;
import com.phillippitts.ambient.domain.RoutingOutcome;
import com.phillippitts.ambient.service.command.handler.ActionHandler;
import com.phillippitts.ambient.service.fallback.FallbackResolver;
import com.phillippitts.ambient.service.metrics.AmbientMetrics;
import com.phillippitts.ambient.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Command surface: routes text, runs the matching handler, resolves fallbacks and records
 * history. Public methods never throw; every failure becomes a structured response.
 */
@Service
public class CommandService {

    private static final Logger LOG = LogManager.getLogger(CommandService.class);

    private final CommandRouter router;
    private final Map<IntentCategory, ActionHandler> handlers;
    private final FallbackResolver fallbackResolver;
    private final PendingConfirmations confirmations;
    private final CommandHistory history;
    private final SuggestionService suggestions;
    private final AmbientMetrics metrics;
    private final Executor commandExecutor;
    private final Clock clock;

    public CommandService(CommandRouter router,
                          List<ActionHandler> handlers,
                          FallbackResolver fallbackResolver,
                          PendingConfirmations confirmations,
                          CommandHistory history,
                          SuggestionService suggestions,
                          AmbientMetrics metrics,
                          @Qualifier("commandExecutor") Executor commandExecutor,
                          Clock clock) {
        this.router = Objects.requireNonNull(router);
        this.handlers = indexByCategory(handlers);
        this.fallbackResolver = Objects.requireNonNull(fallbackResolver);
        this.confirmations = Objects.requireNonNull(confirmations);
        this.history = Objects.requireNonNull(history);
        this.suggestions = Objects.requireNonNull(suggestions);
        this.metrics = Objects.requireNonNull(metrics);
        this.commandExecutor = Objects.requireNonNull(commandExecutor);
        this.clock = Objects.requireNonNull(clock);
    }

    private static Map<IntentCategory, ActionHandler> indexByCategory(List<ActionHandler> handlers) {
        Map<IntentCategory, ActionHandler> map = new EnumMap<>(IntentCategory.class);
        for (ActionHandler h : handlers) {
            ActionHandler previous = map.put(h.category(), h);
            if (previous != null) {
                throw new IllegalStateException("Two handlers for category " + h.category() + ": "
                        + previous.getClass().getSimpleName() + ", " + h.getClass().getSimpleName());
            }
        }
        return map;
    }

    /**
     * Routes and executes a command. The handler runs on the command executor; the caller
     * waits for the result.
     */
    public CommandResponse executeCommand(String text, String sessionId) {
        String commandId = UUID.randomUUID().toString().substring(0, 8);
        ThreadContext.put("commandId", commandId);
        try {
            LOG.info("Command received: '{}'", LogSanitizer.preview(text));
            RoutingDecision decision = router.route(text, sessionId);
            CommandResponse response = switch (decision.outcome()) {
                case READY -> runOnExecutor(decision.intent());
                case NEEDS_CONFIRMATION -> confirmationNeeded(decision);
                case UNRESOLVED -> unresolved(decision.intent());
            };
            record(text, response);
            return response;
        } catch (RuntimeException e) {
            LOG.error("Command failed unexpectedly", e);
            CommandResponse response = failure(Intent.unresolved(text), "Command failed: " + e.getMessage());
            record(text, response);
            return response;
        } finally {
            ThreadContext.remove("commandId");
        }
    }

    /**
     * Executes one context-trigger action on the calling thread with local routing only.
     */
    public CommandResponse executeTriggerAction(String action) {
        try {
            RoutingDecision decision = router.routeLocally(action);
            CommandResponse response = decision.outcome() == RoutingOutcome.READY
                    ? run(decision.intent())
                    : unresolved(decision.intent());
            record(action, response);
            return response;
        } catch (RuntimeException e) {
            LOG.error("Trigger action failed unexpectedly", e);
            CommandResponse response = failure(Intent.unresolved(action), "Command failed: " + e.getMessage());
            record(action, response);
            return response;
        }
    }

    /**
     * Confirms or declines a pending clarification. Confirmed steps are routed locally and
     * executed in order.
     */
    public ConfirmationResponse confirmAndExecute(ConfirmationRequest request) {
        if (request == null) {
            return new ConfirmationResponse(false, false, List.of(), "Missing confirmation request");
        }
        var pending = confirmations.take(request.requestId());
        if (pending.isEmpty()) {
            return new ConfirmationResponse(false, false, List.of(),
                    "No pending confirmation for request " + request.requestId() + " (unknown or expired)");
        }
        Clarification clarification = pending.get();
        if (!request.confirmed()) {
            LOG.info("Clarification {} declined", clarification.requestId());
            return new ConfirmationResponse(true, false, List.of(), "Cancelled");
        }
        try {
            List<CommandResponse> results = CompletableFuture
                    .supplyAsync(() -> runSteps(clarification), commandExecutor)
                    .join();
            long succeeded = results.stream().filter(CommandResponse::success).count();
            return new ConfirmationResponse(succeeded == results.size(), true, results,
                    "Executed " + succeeded + " of " + results.size() + " steps");
        } catch (CompletionException e) {
            LOG.error("Confirmed steps failed unexpectedly", e.getCause());
            return new ConfirmationResponse(false, true, List.of(), "Execution failed: " + e.getCause().getMessage());
        }
    }

    public List<String> getCommandSuggestions(String partial) {
        return suggestions.suggest(partial);
    }

    public List<CommandHistoryEntry> getCommandHistory(int limit) {
        return history.recent(limit);
    }

    private List<CommandResponse> runSteps(Clarification clarification) {
        List<CommandResponse> results = new ArrayList<>();
        for (String step : clarification.actionSteps()) {
            RoutingDecision decision = router.routeLocally(step);
            CommandResponse response = decision.outcome() == RoutingOutcome.READY
                    ? run(decision.intent())
                    : unresolved(decision.intent());
            record(step, response);
            results.add(response);
        }
        return results;
    }

    private CommandResponse runOnExecutor(Intent intent) {
        try {
            return CompletableFuture.supplyAsync(() -> run(intent), commandExecutor).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            LOG.error("Handler failed unexpectedly for {}", intent.category().key(), cause);
            return failure(intent, "Action failed: " + cause.getMessage());
        }
    }

    private CommandResponse run(Intent intent) {
        ActionHandler handler = handlers.get(intent.category());
        if (handler == null) {
            return unresolved(intent);
        }
        long start = System.nanoTime();
        ActionResult result;
        try {
            result = handler.run(intent);
        } catch (RuntimeException e) {
            LOG.error("Handler {} threw", handler.getClass().getSimpleName(), e);
            result = ActionResult.failed("Action failed: " + e.getMessage(), List.of("Try again"));
        }
        long elapsed = System.nanoTime() - start;
        metrics.recordCommand(intent.category().key(), intent.strategy().name().toLowerCase(Locale.ROOT),
                result.success(), elapsed);
        LOG.info("Command executed: category={}, function={}, strategy={}, success={}, {}ms",
                intent.category().key(), intent.functionName(), intent.strategy(), result.success(),
                TimeUnit.NANOSECONDS.toMillis(elapsed));

        if (result.fallback() != null) {
            FallbackResponse fallback = fallbackResolver.resolve(result.fallback());
            return new CommandResponse(false, result.message(), result.message(), intent, RoutingOutcome.READY,
                    null, fallback, fallback.nextSteps());
        }
        return new CommandResponse(result.success(), result.message(), result.success() ? null : result.message(),
                intent, RoutingOutcome.READY, null, null, result.nextSteps());
    }

    private CommandResponse confirmationNeeded(RoutingDecision decision) {
        Clarification c = decision.clarification();
        String result = "Did you mean: " + c.clarifiedIntent() + "?";
        return new CommandResponse(true, result, null, decision.intent(), RoutingOutcome.NEEDS_CONFIRMATION,
                c, null, c.actionSteps());
    }

    private CommandResponse unresolved(Intent intent) {
        String raw = intent.rawCommand() == null ? "" : intent.rawCommand();
        FallbackResponse fallback = fallbackResolver.resolve(new FallbackRequest(FallbackReason.UNKNOWN_ACTION,
                raw, FallbackDetails.forAction(raw)));
        return new CommandResponse(false, fallback.message(), "Could not understand the command", intent,
                RoutingOutcome.UNRESOLVED, null, fallback, fallback.nextSteps());
    }

    private CommandResponse failure(Intent intent, String message) {
        return new CommandResponse(false, message, message, intent, RoutingOutcome.UNRESOLVED, null, null, List.of());
    }

    private void record(String command, CommandResponse response) {
        history.record(new CommandHistoryEntry(command, response.success(), Instant.now(clock),
                LogSanitizer.truncate(response.result(), 200)));
    }
}
