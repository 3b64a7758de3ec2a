package personal.cafe.core.booking.domain.exception;

import personal.cafe.common.exception.BusinessException;
import personal.cafe.common.exception.ErrorCode;
import personal.cafe.core.booking.domain.model.BookingStatus;

/**
 * 진행 상태(PENDING, CONFIRMED)의 예약에 active=false를 지정한 경우
 */
public class CannotDeactivateActiveStatusException extends BusinessException {
    public CannotDeactivateActiveStatusException(BookingStatus status) {
        super(ErrorCode.CANNOT_DEACTIVATE_ACTIVE_STATUS,
                String.format("Cannot set active=false for status %s", status));
    }
}
