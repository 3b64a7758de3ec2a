package personal.cafe.core.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.cafe.core.booking.application.port.in.ExpireBookingsUseCase;
import personal.cafe.core.booking.application.port.out.BookingRepository;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Booking Expiration Service
 * 지난 날짜의 예약 마감 (상태 COMPLETED, active=false, 점유 해제)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingExpirationService implements ExpireBookingsUseCase {

    private final BookingRepository bookingRepository;
    private final Clock clock;

    @Override
    @Transactional
    public int expireBookings() {
        LocalDate today = LocalDate.now(clock);
        int expiredCount = bookingRepository.expireBefore(today, LocalDateTime.now(clock));

        if (expiredCount > 0) {
            log.info("Expired bookings completed: before={}, count={}", today, expiredCount);
        } else {
            log.debug("No bookings to expire: before={}", today);
        }
        return expiredCount;
    }
}
