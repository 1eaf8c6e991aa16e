package com.backoffice.exception;

import com.backoffice.dto.ApiResponse;
import com.backoffice.dto.ResponseCode;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * 전역 예외 처리 핸들러
 *
 * 모든 예외를 일관된 형식의 ApiResponse로 변환하여 반환합니다.
 * 비즈니스 실패는 WARN, 예상하지 못한 예외는 ERROR로 기록합니다.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ApiResponse<Void>> handleBusinessException(BusinessException e) {
        log.warn("BusinessException: code={}, message={}", e.getResponseCode().getCode(), e.getErrorMessage());
        return toResponse(e.getResponseCode(), e.getErrorMessage());
    }

    /**
     * 요청 본문 @Valid 검증 실패
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidationException(MethodArgumentNotValidException e) {
        String errorMessage = e.getBindingResult().getAllErrors().get(0).getDefaultMessage();
        log.warn("ValidationException: {}", errorMessage);
        return toResponse(ResponseCode.BAD_REQUEST, errorMessage);
    }

    /**
     * 경로 변수, 쿼리 파라미터 검증 실패
     */
    @ExceptionHandler({ConstraintViolationException.class, HandlerMethodValidationException.class})
    public ResponseEntity<ApiResponse<Void>> handleParameterValidationException(Exception e) {
        log.warn("ParameterValidationException: {}", e.getMessage());
        return toResponse(ResponseCode.BAD_REQUEST, ResponseCode.BAD_REQUEST.getMessage());
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiResponse<Void>> handleUnreadableRequest(Exception e) {
        log.warn("UnreadableRequest: {}", e.getMessage());
        return toResponse(ResponseCode.BAD_REQUEST, ResponseCode.BAD_REQUEST.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Void>> handleIllegalArgumentException(IllegalArgumentException e) {
        log.warn("IllegalArgumentException: {}", e.getMessage());
        return toResponse(ResponseCode.BAD_REQUEST, e.getMessage());
    }

    /**
     * 행 락 대기 시간 초과, 교착 상태 감지
     */
    @ExceptionHandler(PessimisticLockingFailureException.class)
    public ResponseEntity<ApiResponse<Void>> handleLockFailure(PessimisticLockingFailureException e) {
        log.warn("PessimisticLockingFailure: {}", e.getMessage());
        return toResponse(ResponseCode.CONFLICT, ResponseCode.CONFLICT.getMessage());
    }

    /**
     * 유니크 제약 위반 (동시에 같은 리뷰를 작성하는 경우 등)
     */
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ApiResponse<Void>> handleDataIntegrityViolation(DataIntegrityViolationException e) {
        log.warn("DataIntegrityViolation: {}", e.getMostSpecificCause().getMessage());
        return toResponse(ResponseCode.CONFLICT, ResponseCode.CONFLICT.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleException(Exception e) {
        log.error("UnexpectedException: ", e);
        return toResponse(ResponseCode.INTERNAL_SERVER_ERROR, ResponseCode.INTERNAL_SERVER_ERROR.getMessage());
    }

    private ResponseEntity<ApiResponse<Void>> toResponse(ResponseCode responseCode, String message) {
        return ResponseEntity
                .status(responseCode.getHttpStatus())
                .body(ApiResponse.fail(responseCode, message));
    }
}
