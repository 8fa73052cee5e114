package com.flagship.otp_rental.rental;

import com.flagship.otp_rental.config.ApiHeaders;
import com.flagship.otp_rental.dto.PageResponse;
import com.flagship.otp_rental.rental.dto.RentalSessionView;
import com.flagship.otp_rental.rental.dto.StartRentalRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST endpoints for renting a number and collecting its OTP.
 *
 * The caller is identified by the {@code X-User-Id} header. Errors are mapped
 * to status codes by {@link com.flagship.otp_rental.exception.GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/rentals")
@Validated
@RequiredArgsConstructor
@Slf4j
public class RentalController {

    private final RentalService rentalService;

    @PostMapping("/start")
    public ResponseEntity<RentalSessionView> startRental(
            @RequestHeader(ApiHeaders.USER_ID) Long userId,
            @Valid @RequestBody StartRentalRequest request) {

        log.info("Start rental requested: serviceType={}, carrier={}",
                request.getServiceType().getCode(), request.getCarrier());

        RentalSession session = rentalService.startRental(userId, request.getServiceType(), request.getCarrier());
        return ResponseEntity.ok(RentalSessionView.from(session));
    }

    @PostMapping("/{sessionId}/otp")
    public ResponseEntity<RentalSessionView> pollOtp(
            @RequestHeader(ApiHeaders.USER_ID) Long userId,
            @PathVariable UUID sessionId) {
        return ResponseEntity.ok(RentalSessionView.from(rentalService.pollOtp(sessionId, userId)));
    }

    @GetMapping("/active")
    public ResponseEntity<List<RentalSessionView>> listActive(
            @RequestHeader(ApiHeaders.USER_ID) Long userId,
            @RequestParam(required = false) ServiceType serviceType) {

        List<RentalSessionView> sessions = rentalService.listActive(userId, serviceType).stream()
                .map(RentalSessionView::from)
                .toList();
        return ResponseEntity.ok(sessions);
    }

    @GetMapping("/history")
    public ResponseEntity<PageResponse<RentalSessionView>> history(
            @RequestHeader(ApiHeaders.USER_ID) Long userId,
            @RequestParam(required = false) ServiceType serviceType,
            @RequestParam(defaultValue = "0") @Min(0) int page,
            @RequestParam(defaultValue = "20") @Min(1) @Max(100) int size) {

        Page<RentalSession> sessions = rentalService.history(userId, serviceType, page, size);
        List<RentalSessionView> views = sessions.getContent().stream().map(RentalSessionView::from).toList();
        return ResponseEntity.ok(PageResponse.of(views, page, size, sessions.getTotalElements()));
    }
}
