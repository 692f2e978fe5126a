package com.flagship.donation_pipeline.exception;

import com.flagship.donation_pipeline.config.DonationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Global exception handler for the donation API.
 *
 * Validation details are always returned. Exception messages from unexpected
 * failures and raw PayPal bodies are returned only when
 * {@code donations.errors.include-details} is on.
 */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

    private final DonationProperties properties;

    @ExceptionHandler(DonationValidationException.class)
    public ResponseEntity<ApiError> handleDonationValidation(DonationValidationException e) {
        log.warn("Donation validation failed: {} {}", e.getMessage(), e.getErrors());

        Map<String, Object> details = new LinkedHashMap<>();
        if (!e.getErrors().isEmpty()) {
            details.put("errors", e.getErrors());
        }

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiError.builder()
                .error("Validation Failed")
                .message(e.getMessage())
                .details(details.isEmpty() ? null : details)
                .timestamp(Instant.now())
                .build());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, Object> errors = e.getBindingResult()
                .getFieldErrors()
                .stream()
                .collect(Collectors.toMap(
                        error -> error.getField(),
                        error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                        (existing, replacement) -> existing,
                        LinkedHashMap::new
                ));

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiError.builder()
                .error("Validation Failed")
                .message("Request validation failed")
                .details(errors)
                .timestamp(Instant.now())
                .build());
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class, IllegalArgumentException.class})
    public ResponseEntity<ApiError> handleBadRequest(Exception e) {
        log.warn("Invalid request: {}", e.getMessage());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiError.builder()
                .error("Invalid Request")
                .message(properties.getErrors().isIncludeDetails() ? e.getMessage() : "Malformed request")
                .timestamp(Instant.now())
                .build());
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiError> handleMethodNotAllowed(HttpRequestMethodNotSupportedException e) {
        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED).body(ApiError.builder()
                .error("Method Not Allowed")
                .message("Method not allowed")
                .timestamp(Instant.now())
                .build());
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiError> handleNoResource(NoResourceFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiError.builder()
                .error("Not Found")
                .message("No endpoint " + e.getResourcePath())
                .timestamp(Instant.now())
                .build());
    }

    @ExceptionHandler(PaymentAlreadyProcessedException.class)
    public ResponseEntity<ApiError> handleAlreadyProcessed(PaymentAlreadyProcessedException e) {
        log.info("Capture rejected, order already processed: orderId={}, donationId={}",
                e.getOrderId(), e.getDonationId());

        Map<String, Object> details = new LinkedHashMap<>();
        if (e.getDonationId() != null) {
            details.put("donationId", e.getDonationId());
        }

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiError.builder()
                .error("Already Processed")
                .message(e.getMessage())
                .orderId(e.getOrderId())
                .details(details.isEmpty() ? null : details)
                .timestamp(Instant.now())
                .build());
    }

    @ExceptionHandler(WebhookAuthenticationException.class)
    public ResponseEntity<ApiError> handleWebhookAuthentication(WebhookAuthenticationException e) {
        log.error("Rejected webhook: {}", e.getMessage());

        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(ApiError.builder()
                .error("Unauthorized")
                .message("Invalid signature")
                .timestamp(Instant.now())
                .build());
    }

    @ExceptionHandler(DonationNotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(DonationNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiError.builder()
                .error("Not Found")
                .message(e.getMessage())
                .timestamp(Instant.now())
                .build());
    }

    @ExceptionHandler(PaymentConfigurationException.class)
    public ResponseEntity<ApiError> handleConfiguration(PaymentConfigurationException e) {
        log.error("Payment service misconfigured: {}", e.getMessage());

        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(ApiError.builder()
                .error("Service Unavailable")
                .message("Payment service temporarily unavailable")
                .timestamp(Instant.now())
                .build());
    }

    @ExceptionHandler(PaymentProviderException.class)
    public ResponseEntity<ApiError> handleProvider(PaymentProviderException e) {
        log.error("PayPal request failed: status={}, message={}", e.getStatus(), e.getMessage());

        HttpStatus status = HttpStatus.resolve(e.getStatus());
        if (status == null || status.is2xxSuccessful()) {
            status = HttpStatus.BAD_GATEWAY;
        }

        boolean includeDetails = properties.getErrors().isIncludeDetails();
        Map<String, Object> details = null;
        if (includeDetails && e.getRawBody() != null) {
            details = Map.of("providerResponse", e.getRawBody());
        }

        return ResponseEntity.status(status).body(ApiError.builder()
                .error("Payment Provider Error")
                .message(includeDetails ? e.getMessage() : "Payment processing failed")
                .details(details)
                .timestamp(Instant.now())
                .build());
    }

    @ExceptionHandler(PaymentRecordingException.class)
    public ResponseEntity<ApiError> handleRecording(PaymentRecordingException e) {
        log.error("FINANCIAL DISCREPANCY: captured payment not recorded, transactionId={}, orderId={}",
                e.getTransactionId(), e.getOrderId(), e);

        Map<String, Object> details = null;
        if (properties.getErrors().isIncludeDetails() && e.getCause() != null) {
            details = Map.of("cause", String.valueOf(e.getCause().getMessage()));
        }

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ApiError.builder()
                .error("Recording Failed")
                .message(e.getMessage())
                .partialSuccess(true)
                .transactionId(e.getTransactionId())
                .orderId(e.getOrderId())
                .details(details)
                .timestamp(Instant.now())
                .build());
    }

    @ExceptionHandler(DonationPersistenceException.class)
    public ResponseEntity<ApiError> handlePersistence(DonationPersistenceException e) {
        log.error("Donation persistence failed: {}", e.getMessage(), e);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ApiError.builder()
                .error("Persistence Failed")
                .message(properties.getErrors().isIncludeDetails() ? describe(e) : e.getMessage())
                .timestamp(Instant.now())
                .build());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception e) {
        log.error("Unexpected error", e);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ApiError.builder()
                .error("Internal Server Error")
                .message(properties.getErrors().isIncludeDetails() ? describe(e) : "An unexpected error occurred")
                .timestamp(Instant.now())
                .build());
    }

    private static String describe(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root == e ? e.getMessage() : e.getMessage() + ": " + root.getMessage();
    }
}
