package com.slotsync.booking.common.exception;

import com.slotsync.booking.booking.algorithm.RejectionReason;
import com.slotsync.booking.booking.exception.BookingNotFoundException;
import com.slotsync.booking.booking.exception.BookingRejectedException;
import com.slotsync.booking.eventtypes.exception.EventTypeNotFoundException;
import com.slotsync.booking.settings.exception.AvailabilityExceptionNotFoundException;
import com.slotsync.booking.settings.exception.CalendarSettingsNotFoundException;
import com.slotsync.booking.settings.exception.DuplicateCalendarSettingsException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.HashMap;
import java.util.Map;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    /**
     * 예약 거부 (분류별 상태 코드: 입력 오류 400, 가용 시간 위반 422, 충돌 409)
     */
    @ExceptionHandler(BookingRejectedException.class)
    public ResponseEntity<ErrorResponse> handleBookingRejected(BookingRejectedException e) {
        RejectionReason reason = e.getReason();
        log.warn("예약 거부: {} - {}", reason.getErrorCode(), reason.getMessage());
        ErrorResponse errorResponse = new ErrorResponse(reason.getErrorCode(), reason.getMessage());
        return ResponseEntity.status(statusOf(reason)).body(errorResponse);
    }

    /**
     * 조회 대상 없음
     */
    @ExceptionHandler(BookingNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleBookingNotFound(BookingNotFoundException e) {
        log.error("예약을 찾을 수 없음: {}", e.getMessage());
        ErrorResponse errorResponse = new ErrorResponse("BOOKING_NOT_FOUND", e.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(errorResponse);
    }

    @ExceptionHandler(EventTypeNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleEventTypeNotFound(EventTypeNotFoundException e) {
        log.error("이벤트 타입을 찾을 수 없음: {}", e.getMessage());
        ErrorResponse errorResponse = new ErrorResponse("EVENT_TYPE_NOT_FOUND", e.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(errorResponse);
    }

    @ExceptionHandler(CalendarSettingsNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleCalendarSettingsNotFound(CalendarSettingsNotFoundException e) {
        log.error("캘린더 설정을 찾을 수 없음: {}", e.getMessage());
        ErrorResponse errorResponse = new ErrorResponse("CALENDAR_SETTINGS_NOT_FOUND", e.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(errorResponse);
    }

    @ExceptionHandler(AvailabilityExceptionNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleAvailabilityExceptionNotFound(AvailabilityExceptionNotFoundException e) {
        log.error("가용 시간 예외를 찾을 수 없음: {}", e.getMessage());
        ErrorResponse errorResponse = new ErrorResponse("AVAILABILITY_EXCEPTION_NOT_FOUND", e.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(errorResponse);
    }

    @ExceptionHandler(DuplicateCalendarSettingsException.class)
    public ResponseEntity<ErrorResponse> handleDuplicateCalendarSettings(DuplicateCalendarSettingsException e) {
        log.error("중복된 캘린더 설정: {}", e.getMessage());
        ErrorResponse errorResponse = new ErrorResponse("DUPLICATE_CALENDAR_SETTINGS", e.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(errorResponse);
    }

    /**
     * 잘못된 입력
     */
    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRequest(InvalidRequestException e) {
        log.error("잘못된 요청: {}", e.getMessage());
        ErrorResponse errorResponse = new ErrorResponse("INVALID_REQUEST", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorResponse);
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class,
            MissingRequestHeaderException.class
    })
    public ResponseEntity<ErrorResponse> handleMalformedRequest(Exception e) {
        log.error("요청 형식 오류: {}", e.getMessage());
        ErrorResponse errorResponse = new ErrorResponse("INVALID_REQUEST", "요청 형식이 올바르지 않습니다.");
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorResponse);
    }

    /**
     * 권한 없음 예외 처리
     */
    @ExceptionHandler(UnauthorizedAccessException.class)
    public ResponseEntity<ErrorResponse> handleUnauthorizedAccess(UnauthorizedAccessException e) {
        log.error("권한 없음: {}", e.getMessage());
        ErrorResponse errorResponse = new ErrorResponse("UNAUTHORIZED_ACCESS", e.getMessage());
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(errorResponse);
    }

    /**
     * 저장된 규칙 데이터 손상 (클라이언트가 고칠 수 없는 오류)
     */
    @ExceptionHandler(AvailabilityDataException.class)
    public ResponseEntity<ErrorResponse> handleAvailabilityData(AvailabilityDataException e) {
        log.error("가용 시간 데이터 손상: {}", e.getMessage(), e);
        ErrorResponse errorResponse = new ErrorResponse("INTERNAL_SERVER_ERROR", "서버 내부 오류가 발생했습니다.");
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse);
    }

    /**
     * 존재하지 않는 리소스/엔드포인트 처리 (404)
     */
    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> handleNoResourceFound(NoResourceFoundException e) {
        log.error("존재하지 않는 리소스: {} {}", e.getHttpMethod(), e.getResourcePath());
        ErrorResponse errorResponse = new ErrorResponse("NOT_FOUND", "요청한 API를 찾을 수 없습니다: " + e.getHttpMethod() + " " + e.getResourcePath());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(errorResponse);
    }

    /**
     * @Valid 검증 실패 시 처리
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationExceptions(
            MethodArgumentNotValidException ex) {

        Map<String, Object> response = new HashMap<>();
        Map<String, String> errors = new HashMap<>();

        ex.getBindingResult().getAllErrors().forEach((error) -> {
            String fieldName = error instanceof FieldError ? ((FieldError) error).getField() : error.getObjectName();
            errors.put(fieldName, error.getDefaultMessage());
        });

        response.put("errorCode", "VALIDATION_FAILED");
        response.put("message", "입력값 검증에 실패했습니다");
        response.put("errors", errors);

        log.warn("Validation 실패: {}", errors);

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    /**
     * 모든 예외 처리 (최종 catch-all)
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleAllExceptions(Exception ex) {
        log.error("예상치 못한 예외 발생: {}", ex.getMessage(), ex);
        ErrorResponse errorResponse = new ErrorResponse("INTERNAL_SERVER_ERROR", "서버 내부 오류가 발생했습니다.");
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse);
    }

    private HttpStatus statusOf(RejectionReason reason) {
        switch (reason.getCategory()) {
            case VALIDATION:
                return HttpStatus.BAD_REQUEST;
            case CONFLICT:
                return HttpStatus.CONFLICT;
            case AVAILABILITY:
            default:
                return HttpStatus.UNPROCESSABLE_ENTITY;
        }
    }
}
