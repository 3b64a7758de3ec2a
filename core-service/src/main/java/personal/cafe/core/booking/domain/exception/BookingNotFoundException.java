package personal.cafe.core.booking.domain.exception;

import personal.cafe.common.exception.BusinessException;
import personal.cafe.common.exception.ErrorCode;

/**
 * Booking Not Found Exception
 * 예약을 찾을 수 없을 때 발생
 */
public class BookingNotFoundException extends BusinessException {
    public BookingNotFoundException(Long bookingId) {
        super(ErrorCode.BOOKING_NOT_FOUND,
                String.format("Booking not found: bookingId=%d", bookingId));
    }
}
