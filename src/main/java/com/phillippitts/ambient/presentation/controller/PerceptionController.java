package com.phillippitts.ambient.presentation.controller;

import com.phillippitts.ambient.domain.AppFilter;
import com.phillippitts.ambient.domain.AudioFilter;
import com.phillippitts.ambient.domain.AudioSession;
import com.phillippitts.ambient.domain.ScreenSnapshot;
import com.phillippitts.ambient.service.audio.AudioSentinel;
import com.phillippitts.ambient.service.filter.FilterStore;
import com.phillippitts.ambient.service.perception.PerceptionLifecycle;
import com.phillippitts.ambient.service.perception.PerceptionStatus;
import com.phillippitts.ambient.service.screen.ScreenSentinel;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Sentinel control, perception filters and captured screen/audio records.
 */
@RestController
@RequestMapping("/api")
@Validated
class PerceptionController {

    private final ScreenSentinel screen;
    private final AudioSentinel audio;
    private final FilterStore filters;
    private final PerceptionLifecycle lifecycle;

    PerceptionController(ScreenSentinel screen,
                         AudioSentinel audio,
                         FilterStore filters,
                         PerceptionLifecycle lifecycle) {
        this.screen = screen;
        this.audio = audio;
        this.filters = filters;
        this.lifecycle = lifecycle;
    }

    @PostMapping("/perception/screen/start")
    PerceptionStatus startScreen() {
        screen.start();
        return lifecycle.status();
    }

    @PostMapping("/perception/screen/stop")
    PerceptionStatus stopScreen() {
        screen.stop();
        return lifecycle.status();
    }

    @PostMapping("/perception/audio/start")
    PerceptionStatus startAudio() {
        audio.start();
        return lifecycle.status();
    }

    @PostMapping("/perception/audio/stop")
    PerceptionStatus stopAudio() {
        audio.stop();
        return lifecycle.status();
    }

    @GetMapping("/perception/status")
    PerceptionStatus status() {
        return lifecycle.status();
    }

    @GetMapping("/perception/screen/snapshots")
    List<ScreenSnapshot> screenSnapshots(@RequestParam(defaultValue = "20") @Min(1) @Max(500) int limit) {
        return screen.recentSnapshots(limit);
    }

    @GetMapping("/perception/audio/sessions")
    List<AudioSession> audioSessions(@RequestParam(defaultValue = "20") @Min(1) @Max(500) int limit) {
        return audio.recentSessions(limit);
    }

    @GetMapping("/perception/audio/sessions/search")
    List<AudioSession> searchSessions(@RequestParam("q") String query,
                                      @RequestParam(defaultValue = "20") @Min(1) @Max(500) int limit) {
        return audio.searchTranscripts(query, limit);
    }

    @PostMapping("/filters/screen")
    List<AppFilter> addScreenFilter(@RequestBody AppFilter filter) {
        filters.addAppFilter(filter);
        return filters.listAppFilters();
    }

    @GetMapping("/filters/screen")
    List<AppFilter> screenFilters() {
        return filters.listAppFilters();
    }

    @DeleteMapping("/filters/screen/{appName}")
    ResponseEntity<Void> removeScreenFilter(@PathVariable String appName) {
        return filters.removeAppFilter(appName)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    @PostMapping("/filters/audio")
    List<AudioFilter> addAudioFilter(@RequestBody AudioFilter filter) {
        filters.addAudioFilter(filter);
        return filters.listAudioFilters();
    }

    @GetMapping("/filters/audio")
    List<AudioFilter> audioFilters() {
        return filters.listAudioFilters();
    }

    @DeleteMapping("/filters/audio/{sourceName}")
    ResponseEntity<Void> removeAudioFilter(@PathVariable String sourceName) {
        return filters.removeAudioFilter(sourceName)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }
}
