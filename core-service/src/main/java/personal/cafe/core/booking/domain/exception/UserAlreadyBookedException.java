package personal.cafe.core.booking.domain.exception;

import personal.cafe.common.exception.BusinessException;
import personal.cafe.common.exception.ErrorCode;

import java.time.LocalDate;

/**
 * User Already Booked Exception
 * 사용자가 같은 날짜에 겹치는 시간대의 예약을 이미 가진 경우 발생
 */
public class UserAlreadyBookedException extends BusinessException {
    public UserAlreadyBookedException(Long userId, Long slotId, LocalDate bookingDate) {
        super(ErrorCode.USER_ALREADY_BOOKED,
                String.format("User already has an overlapping booking: userId=%d, slotId=%d, date=%s",
                        userId, slotId, bookingDate));
    }
}
