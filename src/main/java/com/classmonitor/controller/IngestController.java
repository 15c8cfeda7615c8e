package com.classmonitor.controller;

import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import com.classmonitor.dto.ErrorResponse;
import com.classmonitor.dto.ErrorResponse.ErrorCode;
import com.classmonitor.dto.FrameIngestRequest;
import com.classmonitor.dto.ViolationReceipt;
import com.classmonitor.dto.ViolationReport;
import com.classmonitor.exception.IngestException;
import com.classmonitor.model.AlertMessage;
import com.classmonitor.model.Frame;
import com.classmonitor.model.Relay;
import com.classmonitor.service.AlertBroker;
import com.classmonitor.service.RelayRegistry;
import com.classmonitor.service.ViolationReportService;
import com.classmonitor.validation.InputValidator;

import jakarta.validation.Valid;
import reactor.core.publisher.Mono;

/**
 * Entry points for the detection pipeline: annotated frames, alerts and
 * violation reports.
 */
@RestController
public class IngestController {

    private static final Logger logger = LoggerFactory.getLogger(IngestController.class);

    private final RelayRegistry relayRegistry;
    private final AlertBroker alertBroker;
    private final ViolationReportService violationReportService;
    private final InputValidator inputValidator;

    public IngestController(RelayRegistry relayRegistry,
                            AlertBroker alertBroker,
                            ViolationReportService violationReportService,
                            InputValidator inputValidator) {
        this.relayRegistry = relayRegistry;
        this.alertBroker = alertBroker;
        this.violationReportService = violationReportService;
        this.inputValidator = inputValidator;
    }

    /**
     * Push a frame to every viewer of the source.
     */
    @PostMapping("/api/ingest/frames/{sourceKey}")
    public Mono<ResponseEntity<Map<String, Object>>> pushFrame(@PathVariable String sourceKey,
                                                               @Valid @RequestBody FrameIngestRequest request) {
        return Mono.fromCallable(() -> {
            inputValidator.validateSourceKey(sourceKey);
            byte[] jpeg = inputValidator.decodeImage(request.image());

            Relay relay = relayRegistry.getOrCreate(sourceKey);
            int delivered = relay.broadcast(Frame.fromJpeg(sourceKey, jpeg, request.predictions()));
            logger.debug("📥 Frame pushed to source {} reached {}/{} viewers",
                    sourceKey, delivered, relay.getSubscriberCount());

            Map<String, Object> response = new LinkedHashMap<>();
            response.put("sourceKey", sourceKey);
            response.put("delivered", delivered);
            response.put("subscribers", relay.getSubscriberCount());
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
        });
    }

    /**
     * Raise an alert to every device of the identifier (and the mirror recipient).
     */
    @PostMapping("/api/ingest/alerts/{identifier}")
    public Mono<ResponseEntity<AlertBroker.DeliveryReport>> raiseAlert(@PathVariable String identifier,
                                                                       @RequestBody AlertMessage message) {
        return Mono.fromCallable(() -> {
            inputValidator.validateIdentifier(identifier);
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(alertBroker.sendAlert(identifier, message));
        });
    }

    /**
     * Store violation evidence, record it and alert the teacher.
     */
    @PostMapping("/api/admin/report-violation")
    public Mono<ViolationReceipt> reportViolation(@Valid @RequestBody ViolationReport report) {
        logger.info("Violation report for class {} / teacher {}", report.classId(), report.teacherId());
        return violationReportService.report(report);
    }

    @ExceptionHandler(IngestException.class)
    public ResponseEntity<ErrorResponse> handleIngestException(IngestException e) {
        HttpStatus status = e.getErrorCode().getStatus();
        if (status.is5xxServerError()) {
            logger.error("Ingest failed: {}", e.getMessage(), e);
        } else {
            logger.debug("Ingest rejected: {}", e.getMessage());
        }
        return ResponseEntity.status(status).body(ErrorResponse.of(e.getErrorCode(), e.getDetails()));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorResponse> handleBindException(WebExchangeBindException e) {
        String details = e.getFieldErrors().isEmpty()
                ? e.getMessage()
                : e.getFieldErrors().get(0).getField() + " " + e.getFieldErrors().get(0).getDefaultMessage();
        return ResponseEntity.badRequest().body(ErrorResponse.of(ErrorCode.VAL_001, details));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(ServerWebInputException e) {
        return ResponseEntity.badRequest().body(ErrorResponse.of(ErrorCode.VAL_001, e.getReason()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        logger.error("Ingest request failed: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.of(ErrorCode.SRV_001));
    }
}
