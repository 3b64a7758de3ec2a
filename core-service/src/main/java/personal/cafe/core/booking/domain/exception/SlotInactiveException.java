package personal.cafe.core.booking.domain.exception;

import personal.cafe.common.exception.BusinessException;
import personal.cafe.common.exception.ErrorCode;

/**
 * Slot Inactive Exception
 * 비활성화된 시간 슬롯을 예약하려 할 때 발생
 */
public class SlotInactiveException extends BusinessException {
    public SlotInactiveException(Long slotId) {
        super(ErrorCode.SLOT_INACTIVE,
                String.format("Slot is inactive: slotId=%d", slotId));
    }
}
