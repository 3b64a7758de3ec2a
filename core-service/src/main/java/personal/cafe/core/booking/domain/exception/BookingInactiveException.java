package personal.cafe.core.booking.domain.exception;

import personal.cafe.common.exception.BusinessException;
import personal.cafe.common.exception.ErrorCode;

/**
 * Booking Inactive Exception
 * 취소/완료된 예약을 관리자가 아닌 사용자가 변경하려 할 때 발생
 */
public class BookingInactiveException extends BusinessException {
    public BookingInactiveException(Long bookingId) {
        super(ErrorCode.BOOKING_INACTIVE,
                String.format("Booking is inactive: bookingId=%d", bookingId));
    }
}
