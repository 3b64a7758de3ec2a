package personal.cafe.core.booking.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import personal.cafe.core.booking.application.port.in.CreateBookingCommand;
import personal.cafe.core.booking.application.port.out.BookingRepository;
import personal.cafe.core.booking.application.port.out.CafeRepository;
import personal.cafe.core.booking.domain.exception.BookingInactiveException;
import personal.cafe.core.booking.domain.exception.BookingNotFoundException;
import personal.cafe.core.booking.domain.exception.CafeInactiveException;
import personal.cafe.core.booking.domain.exception.CafeNotFoundException;
import personal.cafe.core.booking.domain.model.Booking;
import personal.cafe.core.booking.domain.model.BookingChange;
import personal.cafe.core.booking.domain.model.BookingPatch;
import personal.cafe.core.booking.domain.model.BookingStatus;
import personal.cafe.core.booking.domain.model.Cafe;
import personal.cafe.core.user.domain.model.Actor;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Booking Domain Service (Transaction Manager)
 * 검증과 저장을 하나의 트랜잭션으로 묶는 실행 전용 서비스
 * 점유 정보의 Unique 제약이 커밋 시점의 최종 방어선 역할
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingManager {

    private final BookingRepository bookingRepository;
    private final CafeRepository cafeRepository;
    private final BookingValidator bookingValidator;
    private final BookingLifecycle bookingLifecycle;
    private final Clock clock;

    @Transactional
    public Booking createInTransaction(CreateBookingCommand command, Actor actor) {
        // 1. 테이블/슬롯과 무관한 검증
        bookingValidator.validateBookingDate(command.bookingDate());
        bookingValidator.validateGuestNumber(command.guestNumber());
        requireActiveCafe(command.cafeId());

        // 2. 테이블/슬롯 가용성 검증
        bookingValidator.validateAssignments(
                command.tableSlots(),
                command.cafeId(),
                command.bookingDate(),
                actor.userId(),
                command.guestNumber(),
                null);

        // 3. PENDING 상태로 저장 (점유 Unique 제약 위반 시 DataIntegrityViolationException)
        Booking booking = Booking.create(
                actor.userId(),
                command.cafeId(),
                command.bookingDate(),
                command.guestNumber(),
                command.note(),
                command.tableSlots(),
                LocalDateTime.now(clock));

        return bookingRepository.save(booking);
    }

    /**
     * 예약 부분 수정
     * 실제 변경분이 없으면 검증 없이 기존 예약 반환
     */
    @Transactional
    public BookingChange updateInTransaction(Long bookingId, BookingPatch requested, Actor actor) {
        Booking current = bookingRepository.findById(bookingId)
                .orElseThrow(() -> new BookingNotFoundException(bookingId));

        bookingLifecycle.checkPermission(current, actor);

        BookingPatch patch = requested.diff(current);
        if (patch.isEmpty()) {
            log.debug("No changes requested: bookingId={}", bookingId);
            return BookingChange.unchanged(current);
        }

        if (!current.active() && !actor.isAdmin()) {
            throw new BookingInactiveException(bookingId);
        }

        // 1. 필드별 검증
        if (patch.bookingDate() != null) {
            bookingValidator.validateBookingDate(patch.bookingDate());
        }
        if (patch.guestNumber() != null) {
            bookingValidator.validateGuestNumber(patch.guestNumber());
        }
        if (patch.cafeId() != null) {
            requireActiveCafe(patch.cafeId());
        }

        // 2. 상태 전이 및 활성 여부
        BookingStatus resultingStatus = current.status();
        boolean resultingActive = current.active();
        if (patch.changesStatusOrActive()) {
            if (patch.status() != null) {
                resultingStatus = bookingLifecycle.applyTransition(current.status(), patch.status(), actor.role());
            }
            resultingActive = bookingLifecycle.resolveActive(resultingStatus, patch.active());
        }

        Booking updated = current.withChanges(patch, resultingStatus, resultingActive, LocalDateTime.now(clock));

        // 3. 가용성 재검증 (종료 상태에서 다시 점유 상태가 되는 경우 포함)
        boolean reoccupying = updated.isOccupying() && !current.isOccupying();
        if (patch.changesAvailabilityInputs() || reoccupying) {
            bookingValidator.validateAssignments(
                    updated.tableSlots(),
                    updated.cafeId(),
                    updated.bookingDate(),
                    updated.userId(),
                    updated.guestNumber(),
                    updated.id());
        }

        Booking saved = bookingRepository.save(updated);
        log.debug("Booking updated in transaction: bookingId={}, status={}, active={}",
                saved.id(), saved.status(), saved.active());
        return new BookingChange(current, saved);
    }

    private void requireActiveCafe(Long cafeId) {
        Cafe cafe = cafeRepository.findById(cafeId)
                .orElseThrow(() -> new CafeNotFoundException(cafeId));
        if (!cafe.active()) {
            throw new CafeInactiveException(cafeId);
        }
    }
}
