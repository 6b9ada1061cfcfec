package com.minimember.common.web;

import com.minimember.common.api.ApiCodes;
import com.minimember.common.api.Result;
import com.minimember.common.concurrent.Futures;
import com.minimember.common.exception.MembershipException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.concurrent.CompletionException;

/**
 * 全局异常处理：把常见异常“翻译”为统一的 Result JSON。
 *
 * <p>注意：HTTP 状态码仍然会设置（比如 400/403/503），但响应体结构始终一致。
 * 成员操作失败时 message 就是本地规则或远端给出的原始文案。</p>
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MembershipException.class)
    public ResponseEntity<Result<Void>> handleMembership(MembershipException e) {
        HttpStatus status = HttpStatus.valueOf(e.getError().getHttpStatus());
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(status);
        if (e.getRetryAfterSeconds() != null) {
            builder.header(HttpHeaders.RETRY_AFTER, String.valueOf(e.getRetryAfterSeconds()));
        }
        String msg = (e.getMessage() == null || e.getMessage().isBlank()) ? e.getError().name() : e.getMessage();
        return builder.body(Result.fail(e.getError().getApiCode(), msg, e.getRetryAfterSeconds()));
    }

    /**
     * 异步结果里包着的真实异常。
     */
    @ExceptionHandler(CompletionException.class)
    public ResponseEntity<Result<Void>> handleCompletion(CompletionException e) {
        Throwable cause = Futures.unwrap(e);
        if (cause instanceof MembershipException me) {
            return handleMembership(me);
        }
        if (cause instanceof IllegalArgumentException iae) {
            return handleBadRequest(iae);
        }
        return handleAny(cause instanceof Exception ex ? ex : e);
    }

    /**
     * Spring Validation（@Valid）触发的参数错误。
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Result<Void>> handleValidation(MethodArgumentNotValidException e) {
        // 取第一个错误信息即可
        String msg = e.getBindingResult().getAllErrors().isEmpty()
                ? "invalid_request"
                : e.getBindingResult().getAllErrors().get(0).getDefaultMessage();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Result.fail(ApiCodes.BAD_REQUEST, msg));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Result<Void>> handleUnreadable(Exception e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Result.fail(ApiCodes.BAD_REQUEST, "bad_request"));
    }

    /**
     * 参数校验失败（service 层用 IllegalArgumentException 表达）。
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Result<Void>> handleBadRequest(IllegalArgumentException e) {
        String msg = (e.getMessage() == null || e.getMessage().isBlank()) ? "bad_request" : e.getMessage();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Result.fail(ApiCodes.BAD_REQUEST, msg));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<Result<Void>> handleNoResourceFound(NoResourceFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(Result.fail(ApiCodes.NOT_FOUND, "not_found"));
    }

    /**
     * 兜底：避免默认 HTML 错误页。
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Result<Void>> handleAny(Exception e) {
        log.error("unhandled exception", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Result.fail(ApiCodes.INTERNAL_ERROR, "internal_error"));
    }
}
