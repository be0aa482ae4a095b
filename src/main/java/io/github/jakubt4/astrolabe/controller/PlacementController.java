package io.github.jakubt4.astrolabe.controller;

import io.github.jakubt4.astrolabe.derived.GateActivationAdapter;
import io.github.jakubt4.astrolabe.dto.ErrorResponse;
import io.github.jakubt4.astrolabe.dto.GateResponse;
import io.github.jakubt4.astrolabe.dto.PlacementRequest;
import io.github.jakubt4.astrolabe.dto.SnapshotResponse;
import io.github.jakubt4.astrolabe.ephemeris.ProviderCalculationException;
import io.github.jakubt4.astrolabe.model.PlacementAggregate;
import io.github.jakubt4.astrolabe.service.EphemerisConfigurationException;
import io.github.jakubt4.astrolabe.service.InvalidBirthMomentException;
import io.github.jakubt4.astrolabe.service.PlacementService;
import io.github.jakubt4.astrolabe.service.SnapshotService;
import io.github.jakubt4.astrolabe.zodiac.GateWheel;
import io.github.jakubt4.astrolabe.zodiac.Longitudes;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.stream.Collectors;

/**
 * REST endpoints for natal placements and gate readings.
 *
 * <p>{@code POST /api/placements} returns the full aggregate, {@code POST /api/placements/snapshots}
 * the personality/design snapshot pair and {@code GET /api/gates/{longitude}} a single gate
 * wheel reading.
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class PlacementController {

    private final PlacementService placementService;
    private final SnapshotService snapshotService;
    private final GateActivationAdapter activationSequence;

    /**
     * Computes tropical and sidereal placements for a birth moment.
     *
     * @return {@code 200 OK} with the aggregate, {@code 400} for an invalid birth moment,
     *         {@code 502} when the ephemeris fails, {@code 503} before the ephemeris is verified
     */
    @PostMapping("/placements")
    public ResponseEntity<PlacementAggregate> computePlacements(@Valid @RequestBody final PlacementRequest request) {
        return ResponseEntity.ok(placementService.computePlacements(request.toBirthMoment()));
    }

    @PostMapping("/placements/snapshots")
    public ResponseEntity<SnapshotResponse> computeSnapshots(@Valid @RequestBody final PlacementRequest request) {
        final var snapshot = snapshotService.computeSnapshots(request.toBirthMoment());
        final var offset = snapshot.personality().instant().julianDay() - snapshot.design().instant().julianDay();
        return ResponseEntity.ok(new SnapshotResponse(snapshot, offset, activationSequence.activations(snapshot)));
    }

    @GetMapping("/gates/{longitude}")
    public ResponseEntity<?> gateAt(@PathVariable final double longitude) {
        if (!Double.isFinite(longitude)) {
            return ResponseEntity.badRequest()
                    .body(new ErrorResponse("INVALID_LONGITUDE", "Longitude must be a finite number"));
        }
        final var activation = GateWheel.activation(longitude);
        return ResponseEntity.ok(new GateResponse(Longitudes.normalize(longitude), activation.gate(), activation.line()));
    }

    @ExceptionHandler(InvalidBirthMomentException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBirthMoment(final InvalidBirthMomentException e) {
        log.warn("Rejected birth moment: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, "INVALID_BIRTH_MOMENT", e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(final MethodArgumentNotValidException e) {
        final var message = e.getBindingResult().getFieldErrors().stream()
                .map(field -> field.getField() + " " + field.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return error(HttpStatus.BAD_REQUEST, "INVALID_BIRTH_MOMENT", message);
    }

    @ExceptionHandler(ProviderCalculationException.class)
    public ResponseEntity<ErrorResponse> handleProviderFailure(final ProviderCalculationException e) {
        log.error("[EPHEMERIS] Placement failed: {}", e.getMessage());
        return error(HttpStatus.BAD_GATEWAY, "EPHEMERIS_FAILURE", e.getMessage());
    }

    @ExceptionHandler(EphemerisConfigurationException.class)
    public ResponseEntity<ErrorResponse> handleNotReady(final EphemerisConfigurationException e) {
        return error(HttpStatus.SERVICE_UNAVAILABLE, "EPHEMERIS_NOT_READY", e.getMessage());
    }

    private static ResponseEntity<ErrorResponse> error(final HttpStatus status, final String error,
                                                       final String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(error, message));
    }
}
