package personal.cafe.core.booking.adapter.in.web.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import personal.cafe.core.booking.application.port.in.CreateBookingCommand;
import personal.cafe.core.booking.domain.model.Booking;

import java.time.LocalDate;
import java.util.List;

/**
 * 예약 생성 요청 DTO
 */
public record CreateBookingRequest(
        @NotNull(message = "카페 ID는 필수입니다.")
        Long cafeId,

        @NotNull(message = "예약 날짜는 필수입니다.")
        LocalDate bookingDate,

        @NotNull(message = "인원 수는 필수입니다.")
        @Positive(message = "인원 수는 1명 이상이어야 합니다.")
        Integer guestNumber,

        @Size(max = Booking.MAX_NOTE_LENGTH, message = "메모는 256자 이하여야 합니다.")
        String note,

        @NotEmpty(message = "테이블 슬롯은 하나 이상 선택해야 합니다.")
        List<@Valid TableSlotRequest> tableSlots
) {
    public CreateBookingCommand toCommand(Long userId) {
        return new CreateBookingCommand(
                userId,
                cafeId,
                bookingDate,
                guestNumber,
                note,
                TableSlotRequest.toAssignments(tableSlots));
    }
}
