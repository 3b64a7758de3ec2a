package personal.cafe.core.booking.adapter.in.web.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import personal.cafe.core.booking.application.port.in.UpdateBookingCommand;
import personal.cafe.core.booking.domain.model.Booking;
import personal.cafe.core.booking.domain.model.BookingPatch;
import personal.cafe.core.booking.domain.model.BookingStatus;

import java.time.LocalDate;
import java.util.List;

/**
 * 예약 수정 요청 DTO
 * 전달되지 않은(null) 필드는 변경하지 않음
 */
public record UpdateBookingRequest(
        Long cafeId,

        LocalDate bookingDate,

        @Positive(message = "인원 수는 1명 이상이어야 합니다.")
        Integer guestNumber,

        @Size(max = Booking.MAX_NOTE_LENGTH, message = "메모는 256자 이하여야 합니다.")
        String note,

        BookingStatus status,

        Boolean active,

        @Size(min = 1, message = "테이블 슬롯은 하나 이상 선택해야 합니다.")
        List<@Valid TableSlotRequest> tableSlots
) {
    public UpdateBookingCommand toCommand(Long userId, Long bookingId) {
        BookingPatch patch = new BookingPatch(
                cafeId,
                bookingDate,
                guestNumber,
                note,
                status,
                active,
                tableSlots == null ? null : TableSlotRequest.toAssignments(tableSlots));
        return new UpdateBookingCommand(userId, bookingId, patch);
    }
}
