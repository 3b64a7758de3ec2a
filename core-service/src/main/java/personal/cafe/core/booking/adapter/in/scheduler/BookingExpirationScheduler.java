package personal.cafe.core.booking.adapter.in.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import personal.cafe.core.booking.application.port.in.ExpireBookingsUseCase;

/**
 * Booking Expiration Scheduler (Driving Adapter)
 * 주기적으로 지난 날짜의 예약을 마감
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingExpirationScheduler {

    private final ExpireBookingsUseCase expireBookingsUseCase;

    /**
     * 기본 매시 정각 실행 (booking.expiration.cron)
     */
    @Scheduled(cron = "${booking.expiration.cron:0 0 * * * *}", zone = "${booking.time-zone:Europe/Moscow}")
    public void scheduleExpiration() {
        int expiredCount = expireBookingsUseCase.expireBookings();
        if (expiredCount > 0) {
            log.debug("Scheduled expiration completed: count={}", expiredCount);
        }
    }
}
