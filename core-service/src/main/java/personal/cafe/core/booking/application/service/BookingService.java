package personal.cafe.core.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import personal.cafe.core.booking.application.config.BookingProperties;
import personal.cafe.core.booking.application.port.in.CreateBookingCommand;
import personal.cafe.core.booking.application.port.in.CreateBookingUseCase;
import personal.cafe.core.booking.application.port.in.UpdateBookingCommand;
import personal.cafe.core.booking.application.port.in.UpdateBookingUseCase;
import personal.cafe.core.booking.application.port.out.BookingEventPublisher;
import personal.cafe.core.booking.application.port.out.BookingLockRepository;
import personal.cafe.core.booking.application.port.out.BookingRepository;
import personal.cafe.core.booking.domain.exception.BookingNotFoundException;
import personal.cafe.core.booking.domain.exception.ConcurrentBookingException;
import personal.cafe.core.booking.domain.exception.TableAlreadyBookedException;
import personal.cafe.core.booking.domain.model.Booking;
import personal.cafe.core.booking.domain.model.BookingChange;
import personal.cafe.core.booking.domain.model.BookingEvent;
import personal.cafe.core.booking.domain.model.BookingPatch;
import personal.cafe.core.booking.domain.service.BookingLifecycle;
import personal.cafe.core.booking.domain.service.BookingManager;
import personal.cafe.core.user.application.port.in.ResolveActorUseCase;
import personal.cafe.core.user.domain.model.Actor;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Booking Service
 * 예약 생성/수정 흐름 조율
 *
 * 1. (예약 소유자, 예약 날짜) 단위 Redis 락으로 사용자 시간대 중복 검사를 직렬화
 *    수정 요청은 권한이 없거나 변경분이 없으면 락을 잡지 않고 종료
 * 2. BookingManager 트랜잭션에서 검증 및 저장
 * 3. 커밋 시점 충돌(Unique 제약, Optimistic Lock)은 전체 흐름을 재시도
 * 4. 커밋 이후 알림 이벤트 발행 (실패해도 예약에는 영향 없음)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingService implements CreateBookingUseCase, UpdateBookingUseCase {

    private final ResolveActorUseCase resolveActorUseCase;
    private final BookingRepository bookingRepository;
    private final BookingLockRepository bookingLockRepository;
    private final BookingEventPublisher bookingEventPublisher;
    private final BookingManager bookingManager;
    private final BookingLifecycle bookingLifecycle;
    private final BookingProperties bookingProperties;
    private final Clock clock;

    @Override
    public Booking createBooking(CreateBookingCommand command) {
        Actor actor = resolveActorUseCase.resolveActor(command.userId());

        Booking saved = withUserDateLock(actor.userId(), command.bookingDate(), () ->
                retryOnConflict(
                        () -> bookingManager.createInTransaction(command, actor),
                        () -> new TableAlreadyBookedException(command.bookingDate()),
                        () -> new ConcurrentBookingException(actor.userId(), command.bookingDate())));

        log.info("Booking created: bookingId={}, userId={}, cafeId={}, date={}",
                saved.id(), saved.userId(), saved.cafeId(), saved.bookingDate());

        publishQuietly(BookingEvent.created(saved, LocalDateTime.now(clock)));
        return saved;
    }

    @Override
    public Booking updateBooking(UpdateBookingCommand command) {
        Actor actor = resolveActorUseCase.resolveActor(command.userId());

        // 락 없이 읽기 전용 사전 검사: 존재, 권한, 변경분
        Booking existing = bookingRepository.findById(command.bookingId())
                .orElseThrow(() -> new BookingNotFoundException(command.bookingId()));
        bookingLifecycle.checkPermission(existing, actor);

        BookingPatch requested = command.patch().diff(existing);
        if (requested.isEmpty()) {
            log.debug("Booking update is a no-op: bookingId={}, actorId={}", existing.id(), actor.userId());
            return existing;
        }

        LocalDate targetDate = requested.bookingDate() != null
                ? requested.bookingDate()
                : existing.bookingDate();

        BookingChange change = withUserDateLock(existing.userId(), targetDate, () ->
                retryOnConflict(
                        () -> bookingManager.updateInTransaction(command.bookingId(), command.patch(), actor),
                        () -> new TableAlreadyBookedException(targetDate),
                        () -> new ConcurrentBookingException(command.bookingId())));

        if (!change.isChanged()) {
            return change.after();
        }

        Booking saved = change.after();
        log.info("Booking updated: bookingId={}, actorId={}, status={}, active={}",
                saved.id(), actor.userId(), saved.status(), saved.active());

        publishQuietly(BookingEvent.changed(change, LocalDateTime.now(clock)));
        return saved;
    }

    private <T> T withUserDateLock(Long ownerId, LocalDate bookingDate, Supplier<T> action) {
        String token = UUID.randomUUID().toString();
        boolean locked = bookingLockRepository.tryLock(ownerId, bookingDate, token, bookingProperties.lockTtlSeconds());
        if (!locked) {
            log.warn("Booking write already in progress: userId={}, date={}", ownerId, bookingDate);
            throw new ConcurrentBookingException(ownerId, bookingDate);
        }

        try {
            return action.get();
        } finally {
            bookingLockRepository.unlock(ownerId, bookingDate, token);
        }
    }

    /**
     * 커밋 시점 충돌 시 booking.conflict-retries 만큼 재실행
     * 재실행의 검증 단계에서 보통 TableAlreadyBooked 등 구체적인 예외가 발생함
     */
    private <T> T retryOnConflict(Supplier<T> action,
                                  Supplier<? extends RuntimeException> onConstraintViolation,
                                  Supplier<? extends RuntimeException> onOptimisticLock) {
        int retries = bookingProperties.conflictRetries();
        for (int attempt = 0; ; attempt++) {
            try {
                return action.get();
            } catch (DataIntegrityViolationException e) {
                if (attempt >= retries) {
                    log.warn("Occupancy constraint violated, giving up: attempts={}", attempt + 1);
                    throw onConstraintViolation.get();
                }
                log.warn("Occupancy constraint violated, retrying: attempt={}", attempt + 1);
            } catch (OptimisticLockingFailureException e) {
                if (attempt >= retries) {
                    log.warn("Concurrent modification detected, giving up: attempts={}", attempt + 1);
                    throw onOptimisticLock.get();
                }
                log.warn("Concurrent modification detected, retrying: attempt={}", attempt + 1);
            }
        }
    }

    private void publishQuietly(BookingEvent event) {
        try {
            bookingEventPublisher.publish(event);
        } catch (RuntimeException e) {
            log.error("Failed to dispatch booking event: bookingId={}, type={}",
                    event.booking().id(), event.type(), e);
        }
    }
}
