package personal.cafe.core.booking.application.port.out;

import java.time.LocalDate;

/**
 * Booking Lock Repository (Output Port)
 * (사용자, 예약 날짜) 단위 쓰기 직렬화를 위한 분산 락
 */
public interface BookingLockRepository {

    /**
     * 락 획득 시도
     * Fail-Fast: 획득 실패 시 대기하지 않고 즉시 false 반환
     *
     * @param userId      예약 소유자 ID
     * @param bookingDate 예약 날짜
     * @param token       락 소유자 식별값 (해제 시 검증)
     * @param ttlSeconds  TTL (초)
     * @return true: 획득 성공, false: 다른 요청이 보유 중
     */
    boolean tryLock(Long userId, LocalDate bookingDate, String token, int ttlSeconds);

    /**
     * 락 해제 (token이 일치할 때만)
     */
    void unlock(Long userId, LocalDate bookingDate, String token);
}
