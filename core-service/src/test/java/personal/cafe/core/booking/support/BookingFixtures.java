package personal.cafe.core.booking.support;

import personal.cafe.core.booking.domain.model.Booking;
import personal.cafe.core.booking.domain.model.BookingStatus;
import personal.cafe.core.booking.domain.model.CafeTable;
import personal.cafe.core.booking.domain.model.Slot;
import personal.cafe.core.booking.domain.model.TableSlotAssignment;
import personal.cafe.core.booking.domain.model.TimeInterval;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Set;

/**
 * 예약 테스트 공용 데이터
 * 기준 시각: 2026-10-19 12:00 (Europe/Moscow)
 */
public final class BookingFixtures {

    public static final ZoneId ZONE = ZoneId.of("Europe/Moscow");
    public static final Clock CLOCK = Clock.fixed(Instant.parse("2026-10-19T09:00:00Z"), ZONE);
    public static final LocalDate TODAY = LocalDate.of(2026, 10, 19);
    public static final LocalDate TOMORROW = TODAY.plusDays(1);
    public static final LocalDateTime NOW = LocalDateTime.now(CLOCK);

    public static final Long CAFE_ID = 1L;
    public static final Long OTHER_CAFE_ID = 2L;

    private BookingFixtures() {
    }

    public static CafeTable table(Long id, int seats) {
        return new CafeTable(id, CAFE_ID, seats, true);
    }

    public static Slot slot(Long id, int startHour, int startMinute, int endHour, int endMinute) {
        return new Slot(id, CAFE_ID,
                TimeInterval.of(LocalTime.of(startHour, startMinute), LocalTime.of(endHour, endMinute)), true);
    }

    public static TimeInterval interval(String start, String end) {
        return TimeInterval.of(LocalTime.parse(start), LocalTime.parse(end));
    }

    public static TableSlotAssignment assignment(long tableId, long slotId) {
        return TableSlotAssignment.of(tableId, slotId);
    }

    public static Booking booking(Long id, Long userId, BookingStatus status, TableSlotAssignment... assignments) {
        return new Booking(id, userId, CAFE_ID, TOMORROW, 2, status, status.isActive(), "창가 자리 부탁드립니다",
                Set.of(assignments), NOW.minusDays(1), NOW.minusDays(1));
    }

    public static Booking pendingBooking(Long id, Long userId) {
        return booking(id, userId, BookingStatus.PENDING, assignment(10L, 100L));
    }
}
