package org.example.kbsync.common;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<Result<Void>> handleBusiness(BusinessException e) {
        ResultCode code = e.getResultCode();
        if (code.getCode() >= 500) {
            log.error("业务异常: {}", e.getMessage(), e);
        } else {
            log.warn("业务异常[{}]: {}", code.getCode(), e.getMessage());
        }
        return respond(code, e.getMessage());
    }

    // 并发修改同一文档，另一方已先提交
    @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
    public ResponseEntity<Result<Void>> handleOptimisticLock(ObjectOptimisticLockingFailureException e) {
        log.warn("并发修改冲突: {}", e.getMessage());
        return respond(ResultCode.CONFLICT, "文档已被并发修改，请重试");
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<Result<Void>> handleUploadSize(MaxUploadSizeExceededException e) {
        log.warn("上传文件过大: {}", e.getMessage());
        return respond(ResultCode.PAYLOAD_TOO_LARGE, ResultCode.PAYLOAD_TOO_LARGE.getMessage());
    }

    @ExceptionHandler({IllegalArgumentException.class,
            MissingServletRequestParameterException.class,
            MissingRequestHeaderException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class})
    public ResponseEntity<Result<Void>> handleIllegalArgument(Exception e) {
        log.warn("参数错误: {}", e.getMessage());
        return respond(ResultCode.VALIDATE_FAILED, "参数错误: " + e.getMessage());
    }

    @ExceptionHandler(Exception.class) // 拦截所有未知的 Exception
    public ResponseEntity<Result<Void>> handleException(Exception e) {
        log.error("系统异常: ", e);
        return respond(ResultCode.FAILED, e.getMessage());
    }

    private ResponseEntity<Result<Void>> respond(ResultCode code, String message) {
        return ResponseEntity.status(code.getCode()).body(Result.failed(code, message));
    }
}
