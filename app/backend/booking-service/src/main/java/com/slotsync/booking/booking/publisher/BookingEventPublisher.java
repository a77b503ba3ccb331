package com.slotsync.booking.booking.publisher;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.slotsync.booking.common.entity.Booking;
import com.slotsync.shared.dto.sqs.BookingEventMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;
import software.amazon.awssdk.services.sqs.model.SendMessageRequest;

/**
 * 예약 이벤트 Publisher
 * Booking-Service -> Notification-Lambda (SQS)
 *
 * 발행 실패는 로그만 남기고 예약 처리에는 영향을 주지 않는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingEventPublisher {

    private final SqsAsyncClient sqsAsyncClient;
    private final ObjectMapper objectMapper;

    @Value("${aws.sqs.endpoint:}")
    private String sqsEndpoint;

    @Value("${aws.sqs.queues.booking-notification}")
    private String queueName;

    public void publishBookingConfirmed(Booking booking, String eventTypeName, String ownerTimezone) {
        publish(toMessage(BookingEventMessage.BOOKING_CONFIRMED, booking, eventTypeName, ownerTimezone));
    }

    public void publishBookingCancelled(Booking booking, String eventTypeName, String ownerTimezone) {
        publish(toMessage(BookingEventMessage.BOOKING_CANCELLED, booking, eventTypeName, ownerTimezone));
    }

    private void publish(BookingEventMessage event) {
        try {
            String messageBody = objectMapper.writeValueAsString(event);

            SendMessageRequest request = SendMessageRequest.builder()
                    .queueUrl(getQueueUrl())
                    .messageBody(messageBody)
                    .build();

            sqsAsyncClient.sendMessage(request)
                    .thenAccept(response -> log.info("Published booking event to SQS: eventType={}, bookingId={}, ownerId={}",
                            event.getEventType(), event.getBookingId(), event.getOwnerId()))
                    .exceptionally(throwable -> {
                        log.error("Failed to publish booking event: eventType={}, bookingId={}",
                                event.getEventType(), event.getBookingId(), throwable);
                        return null;
                    });

        } catch (JsonProcessingException e) {
            log.error("Failed to serialize booking event: bookingId={}", event.getBookingId(), e);
        } catch (RuntimeException e) {
            log.error("Failed to send booking event: bookingId={}", event.getBookingId(), e);
        }
    }

    private BookingEventMessage toMessage(String eventType, Booking booking, String eventTypeName, String ownerTimezone) {
        return BookingEventMessage.builder()
                .eventType(eventType)
                .bookingId(booking.getBookingId())
                .ownerId(booking.getOwnerId())
                .eventTypeId(booking.getEventTypeId())
                .eventTypeName(eventTypeName)
                .startTime(booking.getStartTime())
                .endTime(booking.getEndTime())
                .ownerTimezone(ownerTimezone)
                .inviteeName(booking.getInviteeName())
                .inviteeEmail(booking.getInviteeEmail())
                .build();
    }

    /**
     * SQS Queue URL 생성
     */
    private String getQueueUrl() {
        // queueName이 이미 전체 URL인 경우 그대로 사용
        if (queueName.startsWith("https://") || queueName.startsWith("http://")) {
            return queueName;
        }

        // LocalStack: http://localhost:4566/000000000000/queue-name
        if (sqsEndpoint != null && !sqsEndpoint.isBlank()) {
            return String.format("%s/000000000000/%s", sqsEndpoint, queueName);
        }

        // AWS 실제 환경에서는 환경변수로 전체 URL을 주입해야 함
        return queueName;
    }
}
