package com.example.agenda.controllers;

import com.example.agenda.service.exception.AppointmentConflictException;
import com.example.agenda.service.exception.AppointmentNotFoundException;
import com.example.agenda.service.exception.AppointmentValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(AppointmentValidationException.class)
    public ResponseEntity<Map<String, Object>> onValidation(AppointmentValidationException e) {
        return body(HttpStatus.BAD_REQUEST, "validation", e.getMessage());
    }

    @ExceptionHandler(AppointmentNotFoundException.class)
    public ResponseEntity<Map<String, Object>> onNotFound(AppointmentNotFoundException e) {
        ResponseEntity<Map<String, Object>> response = body(HttpStatus.NOT_FOUND, "not_found", e.getMessage());
        response.getBody().put("id", e.getAppointmentId());
        return response;
    }

    @ExceptionHandler(AppointmentConflictException.class)
    public ResponseEntity<Map<String, Object>> onConflict(AppointmentConflictException e) {
        ResponseEntity<Map<String, Object>> response = body(HttpStatus.CONFLICT, "conflict", e.getMessage());
        Map<String, Object> with = new LinkedHashMap<>();
        with.put("id", e.getConflictingId());
        with.put("start", e.getConflictingStart());
        with.put("end", e.getConflictingEnd());
        response.getBody().put("with", with);
        return response;
    }

    /** Another booking held the provider's day for too long; the caller retries the whole request. */
    @ExceptionHandler(PessimisticLockingFailureException.class)
    public ResponseEntity<Map<String, Object>> onLockTimeout(PessimisticLockingFailureException e) {
        log.warn("Schedule lock not acquired: {}", e.getMessage());
        return body(HttpStatus.CONFLICT, "busy", "Provider schedule is being changed concurrently, retry the request");
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class,
            MissingRequestHeaderException.class
    })
    public ResponseEntity<Map<String, Object>> onMalformedRequest(Exception e) {
        log.debug("Malformed request: {}", e.getMessage());
        return body(HttpStatus.BAD_REQUEST, "validation", e.getMessage());
    }

    private ResponseEntity<Map<String, Object>> body(HttpStatus status, String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", code);
        body.put("message", message);
        return ResponseEntity.status(status).body(body);
    }
}
