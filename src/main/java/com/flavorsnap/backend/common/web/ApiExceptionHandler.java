package com.flavorsnap.backend.common.web;

import com.flavorsnap.backend.common.error.ErrorKind;
import com.flavorsnap.backend.common.error.PipelineException;
import com.flavorsnap.backend.common.error.StorageUnavailableException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.transaction.TransactionException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

/**
 * 統一把 pipeline 例外轉成「可預期」的 HTTP 狀態碼與錯誤格式：
 * - 400：VALIDATION_ERROR（含 body 解析失敗 / 缺參數）
 * - 404：NOT_FOUND
 * - 409：VOTING_CLOSED / INVALID_TRANSITION（狀態機規則，不要自動重試）
 * - 503：STORAGE_UNAVAILABLE（可退避重試，帶 Retry-After）
 * - 500：其他未預期錯誤（不回 stack trace）
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(PipelineException.class)
    public ResponseEntity<ErrorResponse> handlePipeline(PipelineException e, HttpServletRequest req) {
        ErrorKind kind = e.kind();
        if (kind.retryable()) {
            log.warn("storage_unavailable code={} rid={}", e.code(), rid(req), e);
            int retry = (e instanceof StorageUnavailableException s) ? s.retryAfterSec() : 1;
            return ResponseEntity.status(kind.httpStatus())
                    .header(HttpHeaders.RETRY_AFTER, String.valueOf(retry))
                    .body(new ErrorResponse(e.code(), kind.name(), StorageUnavailableException.MESSAGE, rid(req), retry));
        }
        log.info("request_rejected kind={} code={} rid={}", kind, e.code(), rid(req));
        return ResponseEntity.status(kind.httpStatus())
                .body(new ErrorResponse(e.code(), kind.name(), e.getMessage(), rid(req)));
    }

    /** commit 時才爆的 DB 錯誤不會經過 store 翻譯，這裡兜底 */
    @ExceptionHandler({DataAccessException.class, TransactionException.class})
    public ResponseEntity<ErrorResponse> handleStorage(RuntimeException e, HttpServletRequest req) {
        return handlePipeline(new StorageUnavailableException("STORAGE_UNAVAILABLE", e), req);
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class,
            MissingServletRequestPartException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMediaTypeNotSupportedException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e, HttpServletRequest req) {
        String msg = "Malformed request body";
        if (e instanceof MissingServletRequestParameterException m) {
            msg = "Missing parameter: " + m.getParameterName();
        } else if (e instanceof MissingServletRequestPartException m) {
            msg = "Missing part: " + m.getRequestPartName();
        } else if (e instanceof MethodArgumentTypeMismatchException m) {
            msg = "Invalid value for parameter: " + m.getName();
        } else if (e instanceof HttpMediaTypeNotSupportedException) {
            msg = "Unsupported content type";
        }
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("BAD_REQUEST", ErrorKind.VALIDATION_ERROR.name(), msg, rid(req)));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnknown(Exception e, HttpServletRequest req) {
        log.error("unhandled_error rid={}", rid(req), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("INTERNAL_ERROR", null, "Internal server error", rid(req)));
    }

    private static String rid(HttpServletRequest req) {
        return RequestIdFilter.getOrCreate(req);
    }
}
