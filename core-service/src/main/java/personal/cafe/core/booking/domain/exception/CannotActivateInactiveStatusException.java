package personal.cafe.core.booking.domain.exception;

import personal.cafe.common.exception.BusinessException;
import personal.cafe.common.exception.ErrorCode;
import personal.cafe.core.booking.domain.model.BookingStatus;

/**
 * 종료 상태(CANCELLED, COMPLETED)의 예약에 active=true를 지정한 경우
 */
public class CannotActivateInactiveStatusException extends BusinessException {
    public CannotActivateInactiveStatusException(BookingStatus status) {
        super(ErrorCode.CANNOT_ACTIVATE_INACTIVE_STATUS,
                String.format("Cannot set active=true for status %s", status));
    }
}
