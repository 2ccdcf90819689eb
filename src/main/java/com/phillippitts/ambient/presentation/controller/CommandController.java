package com.phillippitts.ambient.presentation.controller;

import com.phillippitts.ambient.domain.CommandHistoryEntry;
import com.phillippitts.ambient.service.command.CommandResponse;
import com.phillippitts.ambient.service.command.CommandService;
import com.phillippitts.ambient.service.command.ConfirmationRequest;
import com.phillippitts.ambient.service.command.ConfirmationResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/commands")
@Validated
class CommandController {

    private final CommandService commands;

    CommandController(CommandService commands) {
        this.commands = commands;
    }

    /**
     * @param text command text
     * @param sessionId caller session; the {@code X-Session-ID} header is used when absent
     */
    record CommandRequest(@NotBlank String text, String sessionId) { }

    @PostMapping
    CommandResponse execute(@Valid @RequestBody CommandRequest request,
                            @RequestHeader(value = "X-Session-ID", required = false) String headerSession) {
        String sessionId = request.sessionId() != null ? request.sessionId() : headerSession;
        return commands.executeCommand(request.text(), sessionId);
    }

    @PostMapping("/confirm")
    ConfirmationResponse confirm(@Valid @RequestBody ConfirmationRequest request) {
        return commands.confirmAndExecute(request);
    }

    @GetMapping("/suggestions")
    List<String> suggestions(@RequestParam("q") String partial) {
        return commands.getCommandSuggestions(partial);
    }

    @GetMapping("/history")
    List<CommandHistoryEntry> history(@RequestParam(defaultValue = "20") @Min(1) @Max(500) int limit) {
        return commands.getCommandHistory(limit);
    }
}
