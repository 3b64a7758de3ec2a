package personal.cafe.core.booking.domain.exception;

import personal.cafe.common.exception.BusinessException;
import personal.cafe.common.exception.ErrorCode;

/**
 * Slot Not Found Exception
 * 시간 슬롯이 없거나 다른 카페에 속한 경우 발생
 */
public class SlotNotFoundException extends BusinessException {
    public SlotNotFoundException(Long slotId, Long cafeId) {
        super(ErrorCode.SLOT_NOT_FOUND,
                String.format("Slot not found in cafe: slotId=%d, cafeId=%d", slotId, cafeId));
    }
}
