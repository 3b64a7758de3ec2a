package personal.cafe.core.booking.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.cafe.core.booking.application.port.out.AvailabilityRepository;
import personal.cafe.core.booking.domain.model.BookingStatus;
import personal.cafe.core.booking.domain.model.TimeInterval;

import java.time.LocalDate;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Availability Persistence Adapter
 * 점유 예약(PENDING, CONFIRMED 이면서 active) 기준 가용성 조회
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AvailabilityPersistenceAdapter implements AvailabilityRepository {

    private static final Set<BookingStatus> OCCUPYING_STATUSES =
            EnumSet.of(BookingStatus.PENDING, BookingStatus.CONFIRMED);

    private final JpaBookingRepository jpaBookingRepository;

    @Override
    public boolean isTableOccupied(Long tableId, Long slotId, LocalDate bookingDate, Long excludeBookingId) {
        boolean occupied = jpaBookingRepository.existsOccupying(
                tableId, slotId, bookingDate, OCCUPYING_STATUSES, excludeBookingId);
        log.debug("Occupancy check: tableId={}, slotId={}, date={}, excludeId={}, occupied={}",
                tableId, slotId, bookingDate, excludeBookingId, occupied);
        return occupied;
    }

    @Override
    public List<TimeInterval> findCommittedIntervals(Long userId, LocalDate bookingDate, Long excludeBookingId) {
        log.debug("Finding committed intervals: userId={}, date={}, excludeId={}", userId, bookingDate, excludeBookingId);
        return jpaBookingRepository.findOccupyingSlots(userId, bookingDate, OCCUPYING_STATUSES, excludeBookingId)
                .stream()
                .map(SlotEntity::toInterval)
                .distinct()
                .toList();
    }
}
