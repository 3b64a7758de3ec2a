package personal.cafe.core.booking.application.port.out;

import personal.cafe.core.booking.domain.model.TimeInterval;

import java.time.LocalDate;
import java.util.List;

/**
 * Availability Repository (Output Port)
 * 테이블 점유 여부와 사용자 예약 시간대 조회
 * 점유 예약: status IN (PENDING, CONFIRMED) AND active = true
 */
public interface AvailabilityRepository {

    /**
     * 해당 날짜에 (테이블, 슬롯)을 점유한 다른 예약이 있는지 확인
     *
     * @param excludeBookingId 제외할 예약 ID (수정 시 자기 자신), 없으면 null
     */
    boolean isTableOccupied(Long tableId, Long slotId, LocalDate bookingDate, Long excludeBookingId);

    /**
     * 사용자가 해당 날짜에 점유 중인 예약들의 슬롯 시간대
     *
     * @param excludeBookingId 제외할 예약 ID (수정 시 자기 자신), 없으면 null
     */
    List<TimeInterval> findCommittedIntervals(Long userId, LocalDate bookingDate, Long excludeBookingId);
}
