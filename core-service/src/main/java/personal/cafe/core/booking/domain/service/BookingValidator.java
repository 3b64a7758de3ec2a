package personal.cafe.core.booking.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.cafe.common.exception.BusinessException;
import personal.cafe.common.exception.ErrorCode;
import personal.cafe.core.booking.application.port.out.AvailabilityRepository;
import personal.cafe.core.booking.application.port.out.SlotRepository;
import personal.cafe.core.booking.application.port.out.TableRepository;
import personal.cafe.core.booking.domain.exception.BookingPastDateException;
import personal.cafe.core.booking.domain.exception.NotEnoughSeatsException;
import personal.cafe.core.booking.domain.exception.SlotInactiveException;
import personal.cafe.core.booking.domain.exception.SlotNotFoundException;
import personal.cafe.core.booking.domain.exception.TableAlreadyBookedException;
import personal.cafe.core.booking.domain.exception.TableInactiveException;
import personal.cafe.core.booking.domain.exception.TableNotFoundException;
import personal.cafe.core.booking.domain.exception.UserAlreadyBookedException;
import personal.cafe.core.booking.domain.model.CafeTable;
import personal.cafe.core.booking.domain.model.Slot;
import personal.cafe.core.booking.domain.model.TableSlotAssignment;
import personal.cafe.core.booking.domain.model.TimeInterval;
import personal.cafe.core.booking.domain.model.ValidatedTables;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Booking Validator (Domain Service)
 * 테이블/슬롯 조합의 예약 가능 여부 검증
 *
 * 할당마다 존재 → 활성 → 점유 → 사용자 중복 순으로 확인하고 첫 위반에서 중단한다.
 * 모든 할당을 통과하면 중복 제거된 테이블의 좌석 합계를 인원 수와 비교한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingValidator {

    private final TableRepository tableRepository;
    private final SlotRepository slotRepository;
    private final AvailabilityRepository availabilityRepository;
    private final Clock clock;

    /**
     * @param assignments      요청된 (테이블, 슬롯) 목록
     * @param cafeId           예약 카페
     * @param bookingDate      예약 날짜
     * @param userId           중복 예약을 검사할 사용자 (예약 소유자)
     * @param guestNumber      인원 수
     * @param excludeBookingId 수정 중인 예약 ID, 생성 시 null
     * @return 검증된 테이블 집합과 좌석 합계
     */
    public ValidatedTables validateAssignments(Collection<TableSlotAssignment> assignments,
                                               Long cafeId,
                                               LocalDate bookingDate,
                                               Long userId,
                                               int guestNumber,
                                               Long excludeBookingId) {
        if (assignments == null || assignments.isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Table slots cannot be empty");
        }

        List<TimeInterval> committedIntervals = null;
        Set<CafeTable> tables = new LinkedHashSet<>();

        for (TableSlotAssignment assignment : assignments) {
            CafeTable table = resolveTable(assignment.tableId(), cafeId);
            Slot slot = resolveSlot(assignment.slotId(), cafeId);

            if (availabilityRepository.isTableOccupied(table.id(), slot.id(), bookingDate, excludeBookingId)) {
                log.debug("Table occupied: tableId={}, slotId={}, date={}", table.id(), slot.id(), bookingDate);
                throw new TableAlreadyBookedException(table.id(), slot.id(), bookingDate);
            }

            // 사용자의 기존 시간대는 한 번만 조회
            if (committedIntervals == null) {
                committedIntervals = availabilityRepository.findCommittedIntervals(userId, bookingDate, excludeBookingId);
            }
            boolean userBusy = committedIntervals.stream().anyMatch(interval -> interval.overlaps(slot.interval()));
            if (userBusy) {
                log.debug("User already booked: userId={}, slotId={}, date={}", userId, slot.id(), bookingDate);
                throw new UserAlreadyBookedException(userId, slot.id(), bookingDate);
            }

            tables.add(table);
        }

        ValidatedTables validated = ValidatedTables.of(tables);
        if (guestNumber > validated.totalSeats()) {
            throw new NotEnoughSeatsException(guestNumber, validated.totalSeats());
        }
        return validated;
    }

    /**
     * 예약 날짜는 오늘(booking.time-zone 기준)보다 이후여야 함
     */
    public void validateBookingDate(LocalDate bookingDate) {
        LocalDate today = LocalDate.now(clock);
        if (!bookingDate.isAfter(today)) {
            throw new BookingPastDateException(bookingDate, today);
        }
    }

    public void validateGuestNumber(int guestNumber) {
        if (guestNumber <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    "Guest number must be positive: guestNumber=" + guestNumber);
        }
    }

    private CafeTable resolveTable(Long tableId, Long cafeId) {
        CafeTable table = tableRepository.findById(tableId)
                .filter(found -> found.belongsTo(cafeId))
                .orElseThrow(() -> new TableNotFoundException(tableId, cafeId));
        if (!table.active()) {
            throw new TableInactiveException(tableId);
        }
        return table;
    }

    private Slot resolveSlot(Long slotId, Long cafeId) {
        Slot slot = slotRepository.findById(slotId)
                .filter(found -> found.belongsTo(cafeId))
                .orElseThrow(() -> new SlotNotFoundException(slotId, cafeId));
        if (!slot.active()) {
            throw new SlotInactiveException(slotId);
        }
        return slot;
    }
}
