package personal.cafe.core.booking.application.port.out;

import personal.cafe.core.booking.domain.model.BookingEvent;

/**
 * Booking Event Publisher (Output Port)
 * 예약 알림 이벤트 발행 (Fire-and-Forget)
 */
public interface BookingEventPublisher {

    void publish(BookingEvent event);
}
