package com.classmonitor.service;

import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.classmonitor.dto.ErrorResponse.ErrorCode;
import com.classmonitor.dto.ViolationReceipt;
import com.classmonitor.dto.ViolationReport;
import com.classmonitor.exception.IngestException;
import com.classmonitor.model.AlertEvent;
import com.classmonitor.model.AlertMessage;
import com.classmonitor.validation.InputValidator;

import reactor.core.publisher.Mono;

/**
 * Handles a violation found by the detection pipeline: keep the evidence, record
 * the event, and alert the teacher (and the mirror recipient).
 */
@Service
public class ViolationReportService {

    private static final Logger logger = LoggerFactory.getLogger(ViolationReportService.class);

    private final EvidenceStorageService evidenceStorage;
    private final AlertEventRecorder alertEventRecorder;
    private final AlertBroker alertBroker;
    private final InputValidator inputValidator;

    public ViolationReportService(EvidenceStorageService evidenceStorage,
                                  AlertEventRecorder alertEventRecorder,
                                  AlertBroker alertBroker,
                                  InputValidator inputValidator) {
        this.evidenceStorage = evidenceStorage;
        this.alertEventRecorder = alertEventRecorder;
        this.alertBroker = alertBroker;
        this.inputValidator = inputValidator;
    }

    public Mono<ViolationReceipt> report(ViolationReport report) {
        return Mono.fromCallable(() -> {
                    inputValidator.validateDetail(report.detail());
                    return inputValidator.decodeImage(report.evidence());
                })
                .flatMap(jpeg -> evidenceStorage.store(jpeg)
                        .onErrorMap(e -> !(e instanceof IngestException),
                                e -> new IngestException(ErrorCode.EVID_001, e.getMessage(), e)))
                .map(evidence -> {
                    String sourceKey = String.valueOf(report.classId());
                    String teacher = String.valueOf(report.teacherId());

                    alertEventRecorder.record(AlertEvent.builder()
                            .sourceKey(sourceKey)
                            .targetIdentifier(teacher)
                            .detail(report.detail())
                            .evidenceUrl(evidence.url())
                            .build());

                    AlertMessage alert = new AlertMessage("🚨 " + report.detail(), report.detail(),
                            evidence.url(), Instant.now(), sourceKey);
                    AlertBroker.DeliveryReport delivery = alertBroker.sendAlert(teacher, alert);

                    logger.info("🚨 Violation in class {} reported to teacher {} ({} device(s) notified)",
                            sourceKey, teacher, delivery.delivered());
                    return new ViolationReceipt("success", evidence.url(), delivery.delivered());
                });
    }
}
