package com.phillippitts.ambient.presentation.controller;

import com.phillippitts.ambient.domain.FallbackRequest;
import com.phillippitts.ambient.domain.FallbackResponse;
import com.phillippitts.ambient.service.fallback.FallbackResolver;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
class FallbackController {

    private final FallbackResolver resolver;

    FallbackController(FallbackResolver resolver) {
        this.resolver = resolver;
    }

    @PostMapping("/api/fallback")
    FallbackResponse resolve(@RequestBody FallbackRequest request) {
        return resolver.resolve(request);
    }
}
