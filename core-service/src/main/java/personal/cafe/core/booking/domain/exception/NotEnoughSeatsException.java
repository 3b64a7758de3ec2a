package personal.cafe.core.booking.domain.exception;

import personal.cafe.common.exception.BusinessException;
import personal.cafe.common.exception.ErrorCode;

/**
 * Not Enough Seats Exception
 * 선택한 테이블의 좌석 합계가 인원 수보다 적을 때 발생
 */
public class NotEnoughSeatsException extends BusinessException {
    public NotEnoughSeatsException(int guestNumber, int totalSeats) {
        super(ErrorCode.NOT_ENOUGH_SEATS,
                String.format("Not enough seats: guestNumber=%d, totalSeats=%d", guestNumber, totalSeats));
    }
}
