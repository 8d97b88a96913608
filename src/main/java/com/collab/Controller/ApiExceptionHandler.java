package com.collab.Controller;

import com.collab.exception.CollaborationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

    public record ErrorBody(String code, String error) {}

    @ExceptionHandler(CollaborationException.class)
    public ResponseEntity<ErrorBody> handle(CollaborationException e) {
        HttpStatus status = switch (e.getCode()) {
            case SESSION_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case SESSION_FULL -> HttpStatus.CONFLICT;
            case GUEST_NOT_ALLOWED, READ_ONLY_VIOLATION -> HttpStatus.FORBIDDEN;
            case INVALID_MESSAGE -> HttpStatus.BAD_REQUEST;
        };
        return ResponseEntity.status(status).body(new ErrorBody(e.getCode().name(), e.getMessage()));
    }
}
