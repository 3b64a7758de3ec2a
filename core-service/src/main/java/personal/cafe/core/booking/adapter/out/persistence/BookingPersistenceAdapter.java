package personal.cafe.core.booking.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.cafe.core.booking.application.port.out.BookingRepository;
import personal.cafe.core.booking.domain.exception.BookingNotFoundException;
import personal.cafe.core.booking.domain.model.Booking;
import personal.cafe.core.booking.domain.model.BookingStatus;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

/**
 * Booking Persistence Adapter
 * JPA를 사용한 예약 저장소 구현체
 * 예약 저장 시 점유 테이블(table_slot_occupancies)을 같은 트랜잭션에서 동기화
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingPersistenceAdapter implements BookingRepository {

    private final JpaBookingRepository jpaBookingRepository;
    private final JpaOccupancyRepository jpaOccupancyRepository;

    @Override
    public Booking save(Booking booking) {
        log.debug("Saving booking: bookingId={}, status={}, active={}",
                booking.id(), booking.status(), booking.active());

        BookingEntity entity;
        if (booking.id() == null) {
            entity = jpaBookingRepository.save(BookingEntity.fromDomain(booking));
        } else {
            entity = jpaBookingRepository.findWithTableSlotsById(booking.id())
                    .orElseThrow(() -> new BookingNotFoundException(booking.id()));
            entity.update(booking);
        }
        // version 검증을 트랜잭션 내부에서 수행
        jpaBookingRepository.flush();

        syncOccupancies(entity.getId(), booking);
        return entity.toDomain();
    }

    @Override
    public Optional<Booking> findById(Long bookingId) {
        log.debug("Finding booking: bookingId={}", bookingId);
        return jpaBookingRepository.findWithTableSlotsById(bookingId)
                .map(BookingEntity::toDomain);
    }

    @Override
    public List<Booking> findAll(Long cafeId, Long userId) {
        log.debug("Searching bookings: cafeId={}, userId={}", cafeId, userId);
        return jpaBookingRepository.search(cafeId, userId).stream()
                .map(BookingEntity::toDomain)
                .toList();
    }

    @Override
    public int expireBefore(LocalDate today, LocalDateTime now) {
        int expired = jpaBookingRepository.expireBefore(today,
                EnumSet.of(BookingStatus.PENDING, BookingStatus.CONFIRMED), BookingStatus.COMPLETED, now);
        int released = jpaOccupancyRepository.deleteByBookingDateBefore(today);
        log.debug("Bookings expired: before={}, expired={}, releasedOccupancies={}", today, expired, released);
        return expired;
    }

    /**
     * 점유 행 재작성
     * Unique 제약 위반 시 DataIntegrityViolationException 발생
     */
    private void syncOccupancies(Long bookingId, Booking booking) {
        int removed = jpaOccupancyRepository.deleteByBookingId(bookingId);
        if (!booking.isOccupying()) {
            log.debug("Occupancy released: bookingId={}, removed={}", bookingId, removed);
            return;
        }

        var occupancies = booking.tableSlots().stream()
                .map(assignment -> OccupancyEntity.of(bookingId, assignment, booking.bookingDate()))
                .toList();
        jpaOccupancyRepository.saveAllAndFlush(occupancies);
    }
}
