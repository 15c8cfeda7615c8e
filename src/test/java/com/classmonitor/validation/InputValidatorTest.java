package com.classmonitor.validation;

import com.classmonitor.dto.ErrorResponse.ErrorCode;
import com.classmonitor.exception.IngestException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Base64;

import static org.junit.jupiter.api.Assertions.*;

class InputValidatorTest {

    private final InputValidator validator = new InputValidator();

    @Nested
    @DisplayName("keys")
    class Keys {

        @ParameterizedTest
        @ValueSource(strings = {"7", "room-7", "teacher_5", "A1"})
        void acceptsSafeKeys(String key) {
            assertDoesNotThrow(() -> validator.validateSourceKey(key));
            assertTrue(validator.isValidKey(key));
        }

        @ParameterizedTest
        @ValueSource(strings = {"room 7", "../etc", "room/7", "a;b"})
        void rejectsUnsafeKeys(String key) {
            IngestException e = assertThrows(IngestException.class, () -> validator.validateIdentifier(key));
            assertEquals(ErrorCode.VAL_004, e.getErrorCode());
        }

        @Test
        void rejectsMissingAndOverlongKeys() {
            assertEquals(ErrorCode.VAL_002,
                    assertThrows(IngestException.class, () -> validator.validateSourceKey("")).getErrorCode());
            assertFalse(validator.isValidKey(null));
            assertFalse(validator.isValidKey("x".repeat(65)));
        }
    }

    @Nested
    @DisplayName("images")
    class Images {

        private final byte[] jpeg = {(byte) 0xFF, (byte) 0xD8, 0x01};

        @Test
        void decodesBareBase64() {
            assertArrayEquals(jpeg, validator.decodeImage(Base64.getEncoder().encodeToString(jpeg)));
        }

        @Test
        void decodesDataUri() {
            String uri = "data:image/jpeg;base64," + Base64.getEncoder().encodeToString(jpeg);
            assertArrayEquals(jpeg, validator.decodeImage(uri));
        }

        @Test
        void rejectsInvalidBase64() {
            IngestException e = assertThrows(IngestException.class, () -> validator.decodeImage("@@@@"));
            assertEquals(ErrorCode.VAL_005, e.getErrorCode());
        }

        @Test
        void rejectsBlankImage() {
            IngestException e = assertThrows(IngestException.class, () -> validator.decodeImage(" "));
            assertEquals(ErrorCode.VAL_002, e.getErrorCode());
        }
    }

    @Test
    void detailLength() {
        assertDoesNotThrow(() -> validator.validateDetail("Phone detected"));
        assertEquals(ErrorCode.VAL_003, assertThrows(IngestException.class,
                () -> validator.validateDetail("x".repeat(1001))).getErrorCode());
    }
}
