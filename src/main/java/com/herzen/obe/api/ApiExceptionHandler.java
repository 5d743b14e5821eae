package com.herzen.obe.api;

import com.herzen.obe.exception.AttainmentException;
import com.herzen.obe.exception.IncompleteMappingException;
import com.herzen.obe.exception.InvalidMarkException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(AttainmentException.class)
    public ResponseEntity<Map<String, Object>> handle(AttainmentException e) {
        log.warn("Request refused: {}", e.getMessage());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("code", e.getErrorCode().name());
        body.put("message", e.getMessage());
        body.put("scope", e.getScopeKey());
        body.put("entity", e.getEntityId());
        if (e instanceof InvalidMarkException ime) {
            body.put("rows", ime.getRows());
        } else if (e instanceof IncompleteMappingException imp) {
            body.put("components", imp.getComponentNumbers());
        }
        return ResponseEntity.status(e.getErrorCode().getStatus()).body(body);
    }
}
