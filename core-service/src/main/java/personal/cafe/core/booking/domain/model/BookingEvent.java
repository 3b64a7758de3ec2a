package personal.cafe.core.booking.domain.model;

import java.time.LocalDateTime;

/**
 * Booking Event
 * 예약 변경 커밋 이후 발행되는 알림 이벤트
 */
public record BookingEvent(
        BookingEventType type,
        Booking booking,
        BookingStatus previousStatus,
        LocalDateTime occurredAt
) {
    public static BookingEvent created(Booking booking, LocalDateTime occurredAt) {
        return new BookingEvent(BookingEventType.CREATED, booking, null, occurredAt);
    }

    /**
     * 상태가 바뀌었으면 STATUS_CHANGED, 아니면 UPDATED
     */
    public static BookingEvent changed(BookingChange change, LocalDateTime occurredAt) {
        BookingStatus previous = change.before().status();
        BookingEventType type = previous != change.after().status()
                ? BookingEventType.STATUS_CHANGED
                : BookingEventType.UPDATED;
        return new BookingEvent(type, change.after(), previous, occurredAt);
    }
}
