package personal.cafe.core.booking.domain.model;

/**
 * Booking Status Enum
 * 예약 상태, 활성 여부는 상태로부터 결정됨
 */
public enum BookingStatus {
    /**
     * 확정 대기
     */
    PENDING(true),

    /**
     * 확정
     */
    CONFIRMED(true),

    /**
     * 취소 (종료 상태)
     */
    CANCELLED(false),

    /**
     * 이용 완료 (종료 상태)
     */
    COMPLETED(false);

    private final boolean active;

    BookingStatus(boolean active) {
        this.active = active;
    }

    public boolean isActive() {
        return active;
    }

    public boolean isTerminal() {
        return !active;
    }
}
