package com.trackly.backend.controller;

import com.trackly.backend.model.ErrorResponse;
import jakarta.servlet.RequestDispatcher;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.boot.web.servlet.error.ErrorController;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;

/**
 * Container-level errors (unmapped paths, filter failures) rendered in the
 * same JSON shape as {@code GlobalExceptionHandler}.
 */
@RestController
public class CustomErrorController implements ErrorController {

    private static final String NOT_FOUND_HINT =
            "No such endpoint. Predictions are served from /api/predict?destination=<branch>";

    @RequestMapping(value = "/error", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ErrorResponse> error(HttpServletRequest request) {
        HttpStatus status = statusOf(request.getAttribute(RequestDispatcher.ERROR_STATUS_CODE));
        Object originalUri = request.getAttribute(RequestDispatcher.ERROR_REQUEST_URI);

        return ResponseEntity.status(status).body(ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(status.value())
                .error(status.getReasonPhrase())
                .message(status == HttpStatus.NOT_FOUND ? NOT_FOUND_HINT : "The request could not be completed.")
                .path(originalUri == null ? request.getRequestURI() : originalUri.toString())
                .build());
    }

    private static HttpStatus statusOf(Object code) {
        if (code == null) {
            return HttpStatus.NOT_FOUND;
        }
        HttpStatus status = HttpStatus.resolve(Integer.parseInt(code.toString()));
        return status == null ? HttpStatus.INTERNAL_SERVER_ERROR : status;
    }
}
