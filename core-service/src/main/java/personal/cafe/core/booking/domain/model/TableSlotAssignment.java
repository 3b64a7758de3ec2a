package personal.cafe.core.booking.domain.model;

import personal.cafe.common.exception.BusinessException;
import personal.cafe.common.exception.ErrorCode;

/**
 * Table Slot Assignment
 * 예약에 포함된 (테이블, 시간 슬롯) 한 쌍
 */
public record TableSlotAssignment(
        Long tableId,
        Long slotId
) {
    public TableSlotAssignment {
        if (tableId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Table ID cannot be null");
        }
        if (slotId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Slot ID cannot be null");
        }
    }

    public static TableSlotAssignment of(Long tableId, Long slotId) {
        return new TableSlotAssignment(tableId, slotId);
    }
}
