package personal.cafe.core.booking.adapter.out.kafka;

import personal.cafe.core.booking.domain.model.BookingEvent;
import personal.cafe.core.booking.domain.model.BookingStatus;
import personal.cafe.core.booking.domain.model.TableSlotAssignment;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;

/**
 * Kafka 예약 이벤트 메시지 (JSON)
 */
public record BookingEventMessage(
        String eventType,
        Long bookingId,
        Long userId,
        Long cafeId,
        LocalDate bookingDate,
        int guestNumber,
        BookingStatus status,
        BookingStatus previousStatus,
        boolean active,
        List<TableSlot> tableSlots,
        LocalDateTime occurredAt
) {
    public record TableSlot(Long tableId, Long slotId) {
    }

    public static BookingEventMessage from(BookingEvent event) {
        var booking = event.booking();
        List<TableSlot> tableSlots = booking.tableSlots().stream()
                .sorted(Comparator.comparing(TableSlotAssignment::tableId)
                        .thenComparing(TableSlotAssignment::slotId))
                .map(assignment -> new TableSlot(assignment.tableId(), assignment.slotId()))
                .toList();
        return new BookingEventMessage(
                event.type().name(),
                booking.id(),
                booking.userId(),
                booking.cafeId(),
                booking.bookingDate(),
                booking.guestNumber(),
                booking.status(),
                event.previousStatus(),
                booking.active(),
                tableSlots,
                event.occurredAt());
    }
}
