package com.slotsync.booking.settings.service;

import com.slotsync.booking.availability.algorithm.AvailabilityRuleResolver;
import com.slotsync.booking.common.entity.AvailabilityException;
import com.slotsync.booking.common.entity.AvailabilityException.ExceptionType;
import com.slotsync.booking.common.exception.InvalidRequestException;
import com.slotsync.booking.common.exception.UnauthorizedAccessException;
import com.slotsync.booking.common.repository.AvailabilityExceptionRepository;
import com.slotsync.booking.common.repository.CalendarSettingsRepository;
import com.slotsync.booking.settings.dto.AvailabilityExceptionRequest;
import com.slotsync.booking.settings.dto.AvailabilityExceptionResponse;
import com.slotsync.booking.settings.exception.AvailabilityExceptionNotFoundException;
import com.slotsync.booking.settings.exception.CalendarSettingsNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class AvailabilityExceptionService {

    private final AvailabilityExceptionRepository availabilityExceptionRepository;
    private final CalendarSettingsRepository calendarSettingsRepository;

    /**
     * 예외 목록 조회. from/to가 모두 있으면 해당 날짜 범위(양 끝 포함)만 조회한다.
     */
    @Transactional(readOnly = true)
    public List<AvailabilityExceptionResponse> getExceptions(String cognitoSub, LocalDate from, LocalDate to) {
        log.info("가용 시간 예외 조회 - cognitoSub: {}, 기간: {} ~ {}", cognitoSub, from, to);

        List<AvailabilityException> exceptions;
        if (from != null && to != null) {
            if (to.isBefore(from)) {
                throw new InvalidRequestException("조회 시작 날짜는 종료 날짜보다 늦을 수 없습니다.");
            }
            exceptions = availabilityExceptionRepository.findByOwnerIdAndExceptionDateBetween(cognitoSub, from, to);
        } else {
            exceptions = availabilityExceptionRepository.findByOwnerIdOrderByExceptionDate(cognitoSub);
        }

        return exceptions.stream()
                .map(AvailabilityExceptionResponse::from)
                .collect(Collectors.toList());
    }

    /**
     * 예외 추가
     *
     * BLOCK_OUT은 시간 없이 종일 차단, OVERRIDE는 시작/종료 시각이 필수다.
     */
    @Transactional
    public AvailabilityExceptionResponse createException(AvailabilityExceptionRequest request, String cognitoSub) {
        log.info("가용 시간 예외 생성 요청 - cognitoSub: {}, date: {}, type: {}", cognitoSub, request.getDate(), request.getType());

        calendarSettingsRepository.findByOwnerIdForUpdate(cognitoSub)
                .orElseThrow(() -> new CalendarSettingsNotFoundException("캘린더 설정을 찾을 수 없습니다. cognitoSub: " + cognitoSub));

        AvailabilityException.AvailabilityExceptionBuilder builder = AvailabilityException.builder()
                .ownerId(cognitoSub)
                .exceptionDate(request.getDate())
                .type(request.getType());

        if (request.getType() == ExceptionType.OVERRIDE) {
            if (request.getStartTime() == null || request.getEndTime() == null) {
                throw new InvalidRequestException("OVERRIDE 예외는 시작/종료 시각이 필요합니다.");
            }
            if (!AvailabilityRuleResolver.isOrdered(request.getStartTime(), request.getEndTime())) {
                throw new InvalidRequestException("예외 시간의 시작은 종료보다 이전이어야 합니다.");
            }
            builder.startTime(request.getStartTime()).endTime(request.getEndTime());
        }

        AvailabilityException saved = availabilityExceptionRepository.save(builder.build());
        log.info("가용 시간 예외 생성 완료 - exceptionId: {}", saved.getExceptionId());

        return AvailabilityExceptionResponse.from(saved);
    }

    @Transactional
    public void deleteException(Long exceptionId, String cognitoSub) {
        log.info("가용 시간 예외 삭제 요청 - exceptionId: {}, cognitoSub: {}", exceptionId, cognitoSub);

        AvailabilityException exception = availabilityExceptionRepository.findById(exceptionId)
                .orElseThrow(() -> new AvailabilityExceptionNotFoundException("가용 시간 예외를 찾을 수 없습니다. ID: " + exceptionId));

        if (!exception.getOwnerId().equals(cognitoSub)) {
            throw new UnauthorizedAccessException("해당 예외에 접근할 권한이 없습니다.");
        }

        calendarSettingsRepository.findByOwnerIdForUpdate(cognitoSub)
                .orElseThrow(() -> new CalendarSettingsNotFoundException("캘린더 설정을 찾을 수 없습니다. cognitoSub: " + cognitoSub));

        availabilityExceptionRepository.delete(exception);
        log.info("가용 시간 예외 삭제 완료 - exceptionId: {}", exceptionId);
    }
}
