package com.storyscene.backend.generation.web;

import com.storyscene.backend.common.web.RequestIdFilter;
import com.storyscene.backend.generation.controller.SceneImageController;
import com.storyscene.backend.generation.dto.SceneImageErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

@Slf4j
@RestControllerAdvice(assignableTypes = SceneImageController.class)
@Order(Ordered.HIGHEST_PRECEDENCE)
public class SceneImageExceptionAdvice {

    @ExceptionHandler(SceneGenerationException.class)
    public ResponseEntity<SceneImageErrorResponse> handleGeneration(SceneGenerationException e, HttpServletRequest req) {
        SceneImageErrorResponse body = new SceneImageErrorResponse(
                e.getErrorCode(),
                safeMsgOrCode(e, e.getErrorCode()),
                e.getRequestId() != null ? e.getRequestId() : rid(req),
                e.getStage(),
                e.getDetails().isEmpty() ? null : e.getDetails(),
                e.getCredits(),
                e.getRetryAfterSec()
        );
        ResponseEntity.BodyBuilder b = ResponseEntity.status(e.getHttpStatus());
        // ✅ upstream rate limit is passed through to the client
        if (e.getRetryAfterSec() != null) b.header(HttpHeaders.RETRY_AFTER, String.valueOf(e.getRetryAfterSec()));
        return b.body(body);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<SceneImageErrorResponse> handleIllegalArg(IllegalArgumentException e, HttpServletRequest req) {
        String code = norm(e.getMessage(), "BAD_REQUEST");
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(err(code, e, req));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<SceneImageErrorResponse> handleUnreadable(HttpMessageNotReadableException e, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(SceneImageErrorResponse.of("REQUEST_BODY_INVALID", "Request body is not valid JSON", rid(req)));
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<SceneImageErrorResponse> handleNotFound(NotFoundException e, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(err(norm(e.getMessage(), "NOT_FOUND"), e, req));
    }

    @ExceptionHandler(ForbiddenException.class)
    public ResponseEntity<SceneImageErrorResponse> handleForbidden(ForbiddenException e, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(err(norm(e.getMessage(), "NOT_ALLOWED"), e, req));
    }

    @ExceptionHandler(RequestInProgressException.class)
    public ResponseEntity<SceneImageErrorResponse> handleReqInProgress(RequestInProgressException e, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(e.retryAfterSec()))
                .body(new SceneImageErrorResponse(
                        "REQUEST_IN_PROGRESS",
                        safeMsgOrCode(e, "REQUEST_IN_PROGRESS"),
                        rid(req),
                        null,
                        null,
                        null,
                        e.retryAfterSec()
                ));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<SceneImageErrorResponse> handleStatus(ResponseStatusException e, HttpServletRequest req) {
        String code = norm(e.getReason(), "ERROR");
        return ResponseEntity.status(e.getStatusCode()).body(SceneImageErrorResponse.of(code, code, rid(req)));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<SceneImageErrorResponse> handleUnknown(Exception e, HttpServletRequest req) {
        log.error("scene_image_unhandled rid={} err={}", rid(req), e.toString(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(SceneImageErrorResponse.of("INTERNAL_ERROR", "Unexpected error", rid(req)));
    }

    // ===== helpers =====

    private static SceneImageErrorResponse err(String code, Throwable e, HttpServletRequest req) {
        return SceneImageErrorResponse.of(code, safeMsgOrCode(e, code), rid(req));
    }

    private static String rid(HttpServletRequest req) {
        return RequestIdFilter.getOrCreate(req);
    }

    private static String norm(String msg, String fallback) {
        if (msg == null) return fallback;
        String c = msg.trim();
        return c.isEmpty() ? fallback : c;
    }

    private static String safeMsgOrCode(Throwable t, String code) {
        String m = t.getMessage();
        if (m == null || m.isBlank()) return code;
        return m;
    }
}
