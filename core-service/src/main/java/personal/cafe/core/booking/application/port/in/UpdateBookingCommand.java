package personal.cafe.core.booking.application.port.in;

import personal.cafe.common.exception.BusinessException;
import personal.cafe.common.exception.ErrorCode;
import personal.cafe.core.booking.domain.model.BookingPatch;

/**
 * Update Booking Command
 * 예약 부분 수정 커맨드
 */
public record UpdateBookingCommand(
        Long userId,
        Long bookingId,
        BookingPatch patch
) {
    public UpdateBookingCommand {
        if (userId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "User ID cannot be null");
        }
        if (bookingId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Booking ID cannot be null");
        }
        if (patch == null) {
            patch = BookingPatch.empty();
        }
        if (patch.tableSlots() != null && patch.tableSlots().isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Table slots cannot be empty");
        }
    }
}
