package personal.cafe.core.booking.domain.exception;

import personal.cafe.common.exception.BusinessException;
import personal.cafe.common.exception.ErrorCode;

import java.time.LocalDate;

/**
 * Concurrent Booking Exception
 * 같은 사용자/날짜에 대한 쓰기가 이미 진행 중이거나, 커밋 시점에 동시 수정이 감지된 경우
 */
public class ConcurrentBookingException extends BusinessException {
    public ConcurrentBookingException(Long userId, LocalDate bookingDate) {
        super(ErrorCode.CONCURRENT_BOOKING,
                String.format("Another booking write is in progress: userId=%d, date=%s", userId, bookingDate));
    }

    public ConcurrentBookingException(Long bookingId) {
        super(ErrorCode.CONCURRENT_BOOKING,
                String.format("Booking was modified concurrently: bookingId=%d", bookingId));
    }
}
