package personal.cafe.core.booking.adapter.out.redis;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;
import personal.cafe.core.booking.application.port.out.BookingLockRepository;

import java.time.Duration;
import java.time.LocalDate;
import java.util.Collections;

/**
 * Redis Booking Lock Adapter
 * Redis SETNX 기반 (사용자, 날짜) 쓰기 락 구현체
 * Lua Script를 사용한 원자적 락 해제 (소유권 검증)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisBookingLockAdapter implements BookingLockRepository {

    private static final String BOOKING_LOCK_PREFIX = "booking:lock:user:";
    private final StringRedisTemplate redisTemplate;
    private final RedisScript<Long> releaseLockScript;

    @Override
    public boolean tryLock(Long userId, LocalDate bookingDate, String token, int ttlSeconds) {
        String key = lockKey(userId, bookingDate);

        Boolean success = redisTemplate.opsForValue()
                .setIfAbsent(key, token, Duration.ofSeconds(ttlSeconds));

        boolean locked = Boolean.TRUE.equals(success);

        log.debug("Booking lock attempt: userId={}, date={}, success={}", userId, bookingDate, locked);

        return locked;
    }

    @Override
    public void unlock(Long userId, LocalDate bookingDate, String token) {
        String key = lockKey(userId, bookingDate);

        try {
            Long result = redisTemplate.execute(
                    releaseLockScript,
                    Collections.singletonList(key),
                    token
            );

            if (result != null && result == 1L) {
                log.debug("Booking lock released: userId={}, date={}", userId, bookingDate);
            } else {
                log.warn("Booking lock not owned or already expired: userId={}, date={}", userId, bookingDate);
            }

        } catch (Exception e) {
            // TTL 만료로 결국 해제되므로 예약 결과에는 영향을 주지 않음
            log.error("Error releasing booking lock: userId={}, date={}", userId, bookingDate, e);
        }
    }

    static String lockKey(Long userId, LocalDate bookingDate) {
        return BOOKING_LOCK_PREFIX + userId + ":" + bookingDate;
    }
}
