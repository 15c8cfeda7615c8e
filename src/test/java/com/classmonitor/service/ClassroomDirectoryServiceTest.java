package com.classmonitor.service;

import com.classmonitor.model.Classroom;
import com.classmonitor.repository.ClassroomRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class ClassroomDirectoryServiceTest {

    private ClassroomRepository repository;
    private ClassroomDirectoryService directory;

    @BeforeEach
    void setUp() {
        repository = mock(ClassroomRepository.class);
        when(repository.findById(anyLong())).thenReturn(Mono.empty());
        when(repository.findByName(anyString())).thenReturn(Mono.empty());
        directory = new ClassroomDirectoryService(repository);
    }

    @Test
    void numericKeyIsLookedUpById() {
        when(repository.findById(7L)).thenReturn(Mono.just(new Classroom("Room 7", "10.0.0.7")));

        StepVerifier.create(directory.resolveDeviceAddress("7"))
                .expectNext("10.0.0.7")
                .verifyComplete();
        verify(repository, never()).findByName(anyString());
    }

    @Test
    void otherKeysAreLookedUpByName() {
        when(repository.findByName("room-7")).thenReturn(Mono.just(new Classroom("room-7", "10.0.0.7:81")));

        StepVerifier.create(directory.resolveDeviceAddress("room-7"))
                .expectNext("10.0.0.7:81")
                .verifyComplete();
        verify(repository, never()).findById(anyLong());
    }

    @Test
    void unknownClassroomIsEmpty() {
        StepVerifier.create(directory.resolveDeviceAddress("room-404"))
                .verifyComplete();
    }

    @Test
    void classroomWithoutAddressIsEmpty() {
        when(repository.findById(8L)).thenReturn(Mono.just(new Classroom("Room 8", null)));
        when(repository.findById(9L)).thenReturn(Mono.just(new Classroom("Room 9", "  ")));

        StepVerifier.create(directory.resolveDeviceAddress("8")).verifyComplete();
        StepVerifier.create(directory.resolveDeviceAddress("9")).verifyComplete();
    }
}
