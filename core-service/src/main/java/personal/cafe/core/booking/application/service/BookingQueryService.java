package personal.cafe.core.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.cafe.core.booking.application.port.in.GetBookingUseCase;
import personal.cafe.core.booking.application.port.out.BookingRepository;
import personal.cafe.core.booking.domain.exception.BookingNotFoundException;
import personal.cafe.core.booking.domain.model.Booking;
import personal.cafe.core.booking.domain.service.BookingLifecycle;
import personal.cafe.core.user.application.port.in.ResolveActorUseCase;
import personal.cafe.core.user.domain.model.Actor;

import java.util.List;

/**
 * Booking Query Service
 * 예약 조회 전용 서비스
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class BookingQueryService implements GetBookingUseCase {

    private final ResolveActorUseCase resolveActorUseCase;
    private final BookingRepository bookingRepository;
    private final BookingLifecycle bookingLifecycle;

    @Override
    public Booking getBooking(Long bookingId, Long userId) {
        Actor actor = resolveActorUseCase.resolveActor(userId);

        Booking booking = bookingRepository.findById(bookingId)
                .orElseThrow(() -> {
                    log.warn("Booking not found: bookingId={}", bookingId);
                    return new BookingNotFoundException(bookingId);
                });

        bookingLifecycle.checkPermission(booking, actor);
        return booking;
    }

    @Override
    public List<Booking> getBookings(Long userId, boolean showAll, Long cafeId, Long filterUserId) {
        Actor actor = resolveActorUseCase.resolveActor(userId);

        // 고객이거나 전체 조회가 아니면 본인 예약으로 제한
        Long ownerFilter = (showAll && !actor.isCustomer()) ? filterUserId : actor.userId();
        List<Booking> bookings = bookingRepository.findAll(cafeId, ownerFilter);

        log.debug("Bookings queried: userId={}, showAll={}, cafeId={}, ownerFilter={}, count={}",
                userId, showAll, cafeId, ownerFilter, bookings.size());
        return bookings;
    }
}
