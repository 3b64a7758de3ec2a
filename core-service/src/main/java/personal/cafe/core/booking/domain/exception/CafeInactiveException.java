package personal.cafe.core.booking.domain.exception;

import personal.cafe.common.exception.BusinessException;
import personal.cafe.common.exception.ErrorCode;

/**
 * Cafe Inactive Exception
 * 비활성화된 카페에 예약을 시도할 때 발생
 */
public class CafeInactiveException extends BusinessException {
    public CafeInactiveException(Long cafeId) {
        super(ErrorCode.CAFE_INACTIVE,
                String.format("Cafe is inactive: cafeId=%d", cafeId));
    }
}
