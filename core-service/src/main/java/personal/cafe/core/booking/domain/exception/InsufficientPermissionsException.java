package personal.cafe.core.booking.domain.exception;

import personal.cafe.common.exception.BusinessException;
import personal.cafe.common.exception.ErrorCode;

/**
 * Insufficient Permissions Exception
 * 고객이 본인 소유가 아닌 예약에 접근할 때 발생
 */
public class InsufficientPermissionsException extends BusinessException {
    public InsufficientPermissionsException(Long bookingId, Long userId) {
        super(ErrorCode.INSUFFICIENT_PERMISSIONS,
                String.format("User %d does not have access to booking %d", userId, bookingId));
    }
}
