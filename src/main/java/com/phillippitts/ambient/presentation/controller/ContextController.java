package com.phillippitts.ambient.presentation.controller;

import com.phillippitts.ambient.domain.ContextPattern;
import com.phillippitts.ambient.domain.ContextSnapshot;
import com.phillippitts.ambient.service.context.ContextEngine;
import com.phillippitts.ambient.service.context.ContextStatus;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/context")
@Validated
class ContextController {

    private final ContextEngine engine;

    ContextController(ContextEngine engine) {
        this.engine = engine;
    }

    record QuietHoursRequest(@NotNull @Min(0) @Max(23) Integer startHour,
                             @NotNull @Min(0) @Max(23) Integer endHour) { }

    @PostMapping("/start")
    ContextStatus start() {
        engine.start();
        return engine.status();
    }

    @PostMapping("/stop")
    ContextStatus stop() {
        engine.stop();
        return engine.status();
    }

    @PostMapping("/patterns")
    ResponseEntity<ContextPattern> addPattern(@RequestBody ContextPattern pattern) {
        engine.addContextPattern(pattern);
        return ResponseEntity.status(HttpStatus.CREATED).body(pattern);
    }

    @GetMapping("/patterns")
    List<ContextPattern> patterns() {
        return engine.listPatterns();
    }

    @DeleteMapping("/patterns/{name}")
    ResponseEntity<Void> removePattern(@PathVariable String name) {
        return engine.removeContextPattern(name)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    @PutMapping("/quiet-hours")
    ContextStatus setQuietHours(@Valid @RequestBody QuietHoursRequest request) {
        engine.setQuietHours(request.startHour(), request.endHour());
        return engine.status();
    }

    @DeleteMapping("/quiet-hours")
    ContextStatus clearQuietHours() {
        engine.clearQuietHours();
        return engine.status();
    }

    @GetMapping("/snapshots")
    List<ContextSnapshot> snapshots(@RequestParam(defaultValue = "20") @Min(1) @Max(500) int limit) {
        return engine.recentSnapshots(limit);
    }
}
