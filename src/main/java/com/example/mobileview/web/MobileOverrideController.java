package com.example.mobileview.web;

import com.example.mobileview.session.MobileOverride;
import com.example.mobileview.session.MobileSessionOverrides;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

/**
 * Lets a visitor pin the session to mobile or desktop rendering
 * ({@code mode=force_mobile|ignore_mobile}) or go back to detection
 * ({@code mode=clear}). Registered only when
 * {@code mobile-view.override-endpoint.enabled=true}, also when a host's
 * component scan reaches this package.
 */
@Slf4j
@RestController
@ConditionalOnProperty(name = "mobile-view.override-endpoint.enabled", havingValue = "true")
@RequiredArgsConstructor
public class MobileOverrideController {

    static final String CLEAR = "clear";

    private final MobileSessionOverrides overrides;

    @PostMapping("${mobile-view.override-endpoint.path:/mobile-view/override}")
    public ResponseEntity<Void> override(@RequestParam("mode") String mode, HttpServletRequest request) {
        if (CLEAR.equalsIgnoreCase(mode.trim())) {
            overrides.clear(request);
        } else {
            MobileOverride override = MobileOverride.from(mode)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown override mode: " + mode));
            overrides.set(request, override);
        }
        return ResponseEntity.noContent().build();
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidMode(IllegalArgumentException ex) {
        log.debug("[mobile-view] rejected override request: {}", ex.getMessage());
        Map<String, Object> body = new HashMap<>();
        body.put("error", "invalid_mode");
        body.put("details", ex.getMessage());
        return new ResponseEntity<>(body, HttpStatus.BAD_REQUEST);
    }
}
