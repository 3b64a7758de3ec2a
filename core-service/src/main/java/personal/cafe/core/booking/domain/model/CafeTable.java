package personal.cafe.core.booking.domain.model;

import personal.cafe.common.exception.BusinessException;
import personal.cafe.common.exception.ErrorCode;

/**
 * Cafe Table Domain Model
 * 카페에 속한 테이블 (좌석 수, 활성 여부)
 */
public record CafeTable(
        Long id,
        Long cafeId,
        int seats,
        boolean active
) {
    public CafeTable {
        if (id == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Table ID cannot be null");
        }
        if (cafeId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Table cafe ID cannot be null");
        }
        if (seats <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Table seats must be positive: seats=" + seats);
        }
    }

    public boolean belongsTo(Long otherCafeId) {
        return cafeId.equals(otherCafeId);
    }
}
