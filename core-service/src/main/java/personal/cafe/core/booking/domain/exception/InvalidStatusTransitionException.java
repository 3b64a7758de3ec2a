package personal.cafe.core.booking.domain.exception;

import personal.cafe.common.exception.BusinessException;
import personal.cafe.common.exception.ErrorCode;
import personal.cafe.core.booking.domain.model.BookingStatus;
import personal.cafe.core.user.domain.model.UserRole;

/**
 * Invalid Status Transition Exception
 * 역할별 전이 정책에 없는 상태 변경 요청 시 발생
 */
public class InvalidStatusTransitionException extends BusinessException {
    public InvalidStatusTransitionException(BookingStatus from, BookingStatus to, UserRole role) {
        super(ErrorCode.INVALID_STATUS_TRANSITION,
                String.format("Transition %s -> %s is not allowed for role %s", from, to, role));
    }
}
