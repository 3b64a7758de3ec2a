package personal.cafe.core.booking.domain.exception;

import personal.cafe.common.exception.BusinessException;
import personal.cafe.common.exception.ErrorCode;

import java.time.LocalDate;

/**
 * Booking Past Date Exception
 * 예약 날짜가 오늘 또는 과거인 경우 발생
 */
public class BookingPastDateException extends BusinessException {
    public BookingPastDateException(LocalDate bookingDate, LocalDate today) {
        super(ErrorCode.BOOKING_PAST_DATE,
                String.format("Booking date must be after today: bookingDate=%s, today=%s", bookingDate, today));
    }
}
