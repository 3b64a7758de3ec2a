package personal.cafe.core.booking.domain.model;

import java.time.LocalDate;
import java.util.Objects;
import java.util.Set;

/**
 * Booking Patch
 * 예약 부분 수정 요청, null 필드는 변경하지 않음
 */
public record BookingPatch(
        Long cafeId,
        LocalDate bookingDate,
        Integer guestNumber,
        String note,
        BookingStatus status,
        Boolean active,
        Set<TableSlotAssignment> tableSlots) {

    public BookingPatch {
        if (tableSlots != null) {
            tableSlots = Set.copyOf(tableSlots);
        }
    }

    public static BookingPatch empty() {
        return new BookingPatch(null, null, null, null, null, null, null);
    }

    /**
     * 현재 예약과 실제로 다른 필드만 남긴 패치
     * 테이블 슬롯은 집합으로 비교
     */
    public BookingPatch diff(Booking current) {
        return new BookingPatch(
                changed(cafeId, current.cafeId()),
                changed(bookingDate, current.bookingDate()),
                changed(guestNumber, current.guestNumber()),
                changed(note, current.note()),
                changed(status, current.status()),
                changed(active, current.active()),
                changed(tableSlots, current.tableSlots()));
    }

    private static <T> T changed(T requested, T current) {
        if (requested == null || Objects.equals(requested, current)) {
            return null;
        }
        return requested;
    }

    public boolean isEmpty() {
        return cafeId == null
                && bookingDate == null
                && guestNumber == null
                && note == null
                && status == null
                && active == null
                && tableSlots == null;
    }

    public boolean changesStatusOrActive() {
        return status != null || active != null;
    }

    /**
     * 테이블/슬롯 가용성 재검증이 필요한 변경인지 여부
     */
    public boolean changesAvailabilityInputs() {
        return tableSlots != null || cafeId != null || bookingDate != null || guestNumber != null;
    }
}
