package personal.cafe.core.booking.domain.model;

import personal.cafe.common.exception.BusinessException;
import personal.cafe.common.exception.ErrorCode;

/**
 * Slot Domain Model
 * 카페가 제공하는 하루 중 시간대 (날짜와 무관)
 */
public record Slot(
        Long id,
        Long cafeId,
        TimeInterval interval,
        boolean active
) {
    public Slot {
        if (id == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Slot ID cannot be null");
        }
        if (cafeId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Slot cafe ID cannot be null");
        }
        if (interval == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Slot interval cannot be null");
        }
    }

    public boolean belongsTo(Long otherCafeId) {
        return cafeId.equals(otherCafeId);
    }
}
