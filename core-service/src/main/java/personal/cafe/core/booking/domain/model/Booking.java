package personal.cafe.core.booking.domain.model;

import personal.cafe.common.exception.BusinessException;
import personal.cafe.common.exception.ErrorCode;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Set;

/**
 * Booking Domain Model
 * 예약 도메인 모델 (불변)
 */
public record Booking(
        Long id,
        Long userId,
        Long cafeId,
        LocalDate bookingDate,
        int guestNumber,
        BookingStatus status,
        boolean active,
        String note,
        Set<TableSlotAssignment> tableSlots,
        LocalDateTime createdAt,
        LocalDateTime updatedAt) {

    public static final int MAX_NOTE_LENGTH = 256;

    public Booking {
        if (userId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "User ID cannot be null");
        }
        if (cafeId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Cafe ID cannot be null");
        }
        if (bookingDate == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Booking date cannot be null");
        }
        if (guestNumber <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    "Guest number must be positive: guestNumber=" + guestNumber);
        }
        if (status == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Booking status cannot be null");
        }
        if (tableSlots == null || tableSlots.isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Booking must have at least one table slot");
        }
        if (note != null && note.length() > MAX_NOTE_LENGTH) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    "Booking note is too long: length=" + note.length());
        }
        tableSlots = Set.copyOf(tableSlots);
    }

    /**
     * 예약 생성 (정적 팩토리 메서드)
     * 새 예약은 PENDING, active=true 상태로 시작
     */
    public static Booking create(Long userId,
                                 Long cafeId,
                                 LocalDate bookingDate,
                                 int guestNumber,
                                 String note,
                                 Set<TableSlotAssignment> tableSlots,
                                 LocalDateTime now) {
        return new Booking(
                null,
                userId,
                cafeId,
                bookingDate,
                guestNumber,
                BookingStatus.PENDING,
                BookingStatus.PENDING.isActive(),
                note,
                tableSlots,
                now,
                now);
    }

    /**
     * 테이블/슬롯을 점유 중인지 여부 (PENDING 또는 CONFIRMED 이면서 active)
     */
    public boolean isOccupying() {
        return active && status.isActive();
    }

    public boolean isOwnedBy(Long otherUserId) {
        return userId.equals(otherUserId);
    }

    /**
     * 변경분 적용
     * 상태와 활성 여부는 Lifecycle 검증을 거친 값을 전달받음
     */
    public Booking withChanges(BookingPatch patch,
                               BookingStatus resultingStatus,
                               boolean resultingActive,
                               LocalDateTime now) {
        return new Booking(
                id,
                userId,
                patch.cafeId() != null ? patch.cafeId() : cafeId,
                patch.bookingDate() != null ? patch.bookingDate() : bookingDate,
                patch.guestNumber() != null ? patch.guestNumber() : guestNumber,
                resultingStatus,
                resultingActive,
                patch.note() != null ? patch.note() : note,
                patch.tableSlots() != null ? patch.tableSlots() : tableSlots,
                createdAt,
                now);
    }
}
