package personal.cafe.core.booking.domain.exception;

import personal.cafe.common.exception.BusinessException;
import personal.cafe.common.exception.ErrorCode;

import java.time.LocalDate;

/**
 * Table Already Booked Exception
 * 같은 날짜, 같은 (테이블, 슬롯)에 점유 중인 예약이 있을 때 발생
 * HTTP 409 Conflict 반환용
 */
public class TableAlreadyBookedException extends BusinessException {
    public TableAlreadyBookedException(Long tableId, Long slotId, LocalDate bookingDate) {
        super(ErrorCode.TABLE_ALREADY_BOOKED,
                String.format("Table already booked: tableId=%d, slotId=%d, date=%s", tableId, slotId, bookingDate));
    }

    /**
     * DB Unique 제약 위반으로 감지된 경우 (어떤 쌍이 충돌했는지 알 수 없음)
     */
    public TableAlreadyBookedException(LocalDate bookingDate) {
        super(ErrorCode.TABLE_ALREADY_BOOKED,
                String.format("Table slot occupied by a concurrent booking: date=%s", bookingDate));
    }
}
