package personal.cafe.core.booking.adapter.in.web.dto;

import personal.cafe.core.booking.domain.model.Booking;
import personal.cafe.core.booking.domain.model.BookingStatus;
import personal.cafe.core.booking.domain.model.TableSlotAssignment;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;

/**
 * 예약 조회/생성/수정 응답 DTO
 */
public record BookingResponse(
        Long bookingId,
        Long userId,
        Long cafeId,
        LocalDate bookingDate,
        int guestNumber,
        BookingStatus status,
        boolean active,
        String note,
        List<TableSlotResponse> tableSlots,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
    public record TableSlotResponse(Long tableId, Long slotId) {
    }

    public static BookingResponse from(Booking booking) {
        List<TableSlotResponse> tableSlots = booking.tableSlots().stream()
                .sorted(Comparator.comparing(TableSlotAssignment::tableId)
                        .thenComparing(TableSlotAssignment::slotId))
                .map(assignment -> new TableSlotResponse(assignment.tableId(), assignment.slotId()))
                .toList();
        return new BookingResponse(
                booking.id(),
                booking.userId(),
                booking.cafeId(),
                booking.bookingDate(),
                booking.guestNumber(),
                booking.status(),
                booking.active(),
                booking.note(),
                tableSlots,
                booking.createdAt(),
                booking.updatedAt()
        );
    }
}
