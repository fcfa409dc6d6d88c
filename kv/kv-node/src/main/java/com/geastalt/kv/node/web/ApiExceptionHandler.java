/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.node.web;

import com.geastalt.kv.api.ApiResponse;
import com.geastalt.kv.model.KvError;
import com.geastalt.kv.node.raft.storage.StorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Converts request parsing failures into INVALID_REQUEST envelopes.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMediaTypeNotSupportedException.class
    })
    public ResponseEntity<ApiResponse<Void>> handleBadRequest(Exception e) {
        log.debug("Rejected malformed request: {}", e.getMessage());
        var error = KvError.invalidRequest("Malformed request: " + e.getMessage());
        return ResponseEntity.status(error.status().httpStatus()).body(ApiResponse.failure(error));
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<ApiResponse<Void>> handleStorage(StorageException e) {
        log.error("Storage failure while handling request: {}", e.getMessage(), e);
        var error = KvError.error("Storage failure: " + e.getMessage());
        return ResponseEntity.status(error.status().httpStatus()).body(ApiResponse.failure(error));
    }
}
