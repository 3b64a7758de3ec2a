package personal.cafe.core.booking.domain.exception;

import personal.cafe.common.exception.BusinessException;
import personal.cafe.common.exception.ErrorCode;

/**
 * Cafe Not Found Exception
 * 카페를 찾을 수 없을 때 발생
 */
public class CafeNotFoundException extends BusinessException {
    public CafeNotFoundException(Long cafeId) {
        super(ErrorCode.CAFE_NOT_FOUND,
                String.format("Cafe not found: cafeId=%d", cafeId));
    }
}
