package personal.cafe.core.booking.application.port.in;

import personal.cafe.common.exception.BusinessException;
import personal.cafe.common.exception.ErrorCode;
import personal.cafe.core.booking.domain.model.TableSlotAssignment;

import java.time.LocalDate;
import java.util.Set;

/**
 * Create Booking Command
 * 예약 생성 커맨드
 */
public record CreateBookingCommand(
        Long userId,
        Long cafeId,
        LocalDate bookingDate,
        Integer guestNumber,
        String note,
        Set<TableSlotAssignment> tableSlots
) {
    public CreateBookingCommand {
        if (userId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "User ID cannot be null");
        }
        if (cafeId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Cafe ID cannot be null");
        }
        if (bookingDate == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Booking date cannot be null");
        }
        if (guestNumber == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Guest number cannot be null");
        }
        if (tableSlots == null || tableSlots.isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Table slots cannot be empty");
        }
        tableSlots = Set.copyOf(tableSlots);
    }
}
