package personal.cafe.core.booking.domain.model;

/**
 * 수정 전후 예약
 * 변경 사항이 없으면 before와 after가 같은 인스턴스
 */
public record BookingChange(
        Booking before,
        Booking after
) {
    public static BookingChange unchanged(Booking booking) {
        return new BookingChange(booking, booking);
    }

    public boolean isChanged() {
        return before != after;
    }
}
