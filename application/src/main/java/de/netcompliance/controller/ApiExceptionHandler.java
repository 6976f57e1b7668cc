package de.netcompliance.controller;

import de.netcompliance.core.exception.ComplianceDefinitionException;
import de.netcompliance.exception.ResourceConflictException;
import de.netcompliance.exception.ResourceNotFoundException;
import de.netcompliance.model.ErrorDto;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(ComplianceDefinitionException.class)
    public ResponseEntity<ErrorDto> handleDefinitionError(final ComplianceDefinitionException e) {
        log.info("Rejected request: {}", e.getMessages());
        return error(HttpStatus.BAD_REQUEST, e.getMessages());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorDto> handleInvalidArgument(final MethodArgumentNotValidException e) {
        var messages = e.getBindingResult().getFieldErrors().stream()
                .map(fieldError -> "%s %s".formatted(fieldError.getField(), fieldError.getDefaultMessage()))
                .toList();
        return error(HttpStatus.BAD_REQUEST, messages);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorDto> handleUnreadableBody(final HttpMessageNotReadableException e) {
        return error(HttpStatus.BAD_REQUEST, List.of("Request body cannot be read"));
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorDto> handleNotFound(final ResourceNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, List.of(e.getMessage()));
    }

    @ExceptionHandler(ResourceConflictException.class)
    public ResponseEntity<ErrorDto> handleConflict(final ResourceConflictException e) {
        return error(HttpStatus.CONFLICT, List.of(e.getMessage()));
    }

    private static ResponseEntity<ErrorDto> error(final HttpStatus status, final List<String> messages) {
        return ResponseEntity.status(status).body(ErrorDto.builder()
                .status(status.value())
                .error(status.getReasonPhrase())
                .messages(messages)
                .build());
    }
}
