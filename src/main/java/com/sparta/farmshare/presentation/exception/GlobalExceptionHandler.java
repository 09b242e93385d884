package com.sparta.farmshare.presentation.exception;

import com.sparta.farmshare.domain.common.exception.BusinessException;
import com.sparta.farmshare.domain.common.exception.ErrorCode;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * 전역 예외 처리 핸들러
 * 모든 예외를 HTTP 응답으로 변환
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * 비즈니스 예외 처리
     * HTTP 상태는 ErrorCode가 결정
     */
    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ErrorResponse> handleBusinessException(BusinessException e) {
        if (e.getStatus().is5xxServerError()) {
            log.error("비즈니스 예외 - code={}, message={}", e.getCode(), e.getMessage(), e);
        } else {
            log.debug("비즈니스 예외 - code={}, message={}", e.getCode(), e.getMessage());
        }

        return ResponseEntity
            .status(e.getStatus())
            .body(new ErrorResponse(e.getCode(), e.getMessage()));
    }

    /**
     * 일반 예외 처리
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleException(Exception e) {
        log.error("처리되지 않은 예외", e);

        ErrorResponse errorResponse = new ErrorResponse(
            ErrorCode.COMMON004.getCode(),
            ErrorCode.COMMON004.getMessage()
        );
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(errorResponse);
    }

    /**
     * IllegalArgumentException 처리
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(IllegalArgumentException e) {
        return badRequest(ErrorCode.COMMON002, e.getMessage());
    }

    /**
     * @RequestBody 검증 실패 처리
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(FieldError::getDefaultMessage)
            .orElse(ErrorCode.COMMON001.getMessage());

        return badRequest(ErrorCode.COMMON001, message);
    }

    /**
     * Bean Validation 예외 처리 (@PathVariable, @RequestParam 검증 실패)
     */
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolationException(ConstraintViolationException e) {
        // 첫 번째 violation의 메시지 가져오기
        String message = e.getConstraintViolations().stream()
            .findFirst()
            .map(ConstraintViolation::getMessage)
            .orElse(ErrorCode.COMMON001.getMessage());

        return badRequest(ErrorCode.COMMON001, message);
    }

    /**
     * 필수 파라미터/헤더 누락, 타입 불일치, 본문 파싱 실패
     */
    @ExceptionHandler({
        MissingServletRequestParameterException.class,
        MissingRequestHeaderException.class,
        MethodArgumentTypeMismatchException.class,
        HttpMessageNotReadableException.class
    })
    public ResponseEntity<ErrorResponse> handleMalformedRequest(Exception e) {
        log.debug("잘못된 요청 형식 - {}", e.getMessage());
        return badRequest(ErrorCode.COMMON002, ErrorCode.COMMON002.getMessage());
    }

    /**
     * 낙관적 락 충돌 예외 처리
     */
    @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handleOptimisticLockingFailure(ObjectOptimisticLockingFailureException e) {
        ErrorResponse errorResponse = new ErrorResponse(
            ErrorCode.COMMON003.getCode(),
            ErrorCode.COMMON003.getMessage()
        );
        return ResponseEntity
            .status(HttpStatus.CONFLICT)
            .body(errorResponse);
    }

    private ResponseEntity<ErrorResponse> badRequest(ErrorCode errorCode, String message) {
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ErrorResponse(errorCode.getCode(), message));
    }
}
