package com.classmonitor.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.classmonitor.model.Classroom;
import com.classmonitor.repository.ClassroomRepository;

import reactor.core.publisher.Mono;

/**
 * Resolves a source key to the address of its camera.
 * A numeric key is a classroom id; anything else is a classroom name.
 */
@Service
public class ClassroomDirectoryService {

    private static final Logger logger = LoggerFactory.getLogger(ClassroomDirectoryService.class);

    private final ClassroomRepository classroomRepository;

    public ClassroomDirectoryService(ClassroomRepository classroomRepository) {
        this.classroomRepository = classroomRepository;
    }

    /**
     * @return the device address, or empty if the classroom is unknown or has no address
     */
    public Mono<String> resolveDeviceAddress(String sourceKey) {
        return lookup(sourceKey)
                .mapNotNull(Classroom::getDeviceAddress)
                .filter(address -> !address.isBlank())
                .switchIfEmpty(Mono.fromRunnable(() ->
                        logger.debug("No device address registered for source {}", sourceKey)));
    }

    private Mono<Classroom> lookup(String sourceKey) {
        if (isNumeric(sourceKey)) {
            return classroomRepository.findById(Long.valueOf(sourceKey));
        }
        return classroomRepository.findByName(sourceKey);
    }

    private boolean isNumeric(String key) {
        if (key.isEmpty() || key.length() > 18) {
            return false;
        }
        for (int i = 0; i < key.length(); i++) {
            if (!Character.isDigit(key.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
