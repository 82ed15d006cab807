package com.mlregistry.dataset.config;

import com.mlregistry.common.exception.ErrorCode;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the error code to HTTP status mapping
 */
public class GlobalExceptionHandlerTest {

    @Test
    void testErrorKindsMapToDistinctStatuses() {
        assertEquals(HttpStatus.BAD_REQUEST, GlobalExceptionHandler.mapErrorCodeToHttpStatus(ErrorCode.INVALID_BROKER_PORT));
        assertEquals(HttpStatus.NOT_FOUND, GlobalExceptionHandler.mapErrorCodeToHttpStatus(ErrorCode.TOPIC_NOT_FOUND));
        assertEquals(HttpStatus.CONFLICT, GlobalExceptionHandler.mapErrorCodeToHttpStatus(ErrorCode.BROKER_ALREADY_EXISTS));
        assertEquals(HttpStatus.NOT_FOUND, GlobalExceptionHandler.mapErrorCodeToHttpStatus(ErrorCode.NO_MESSAGES_FOUND));
        assertEquals(HttpStatus.BAD_GATEWAY, GlobalExceptionHandler.mapErrorCodeToHttpStatus(ErrorCode.BROKER_UNREACHABLE));
        assertEquals(HttpStatus.BAD_GATEWAY, GlobalExceptionHandler.mapErrorCodeToHttpStatus(ErrorCode.MESSAGE_DECODE_FAILED));
        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR,
                GlobalExceptionHandler.mapErrorCodeToHttpStatus(ErrorCode.METADATA_STORE_ERROR));
        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR,
                GlobalExceptionHandler.mapErrorCodeToHttpStatus(ErrorCode.UNKNOWN_ERROR));
    }
}
