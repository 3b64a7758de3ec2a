package personal.cafe.core.booking.application.port.out;

import personal.cafe.core.booking.domain.model.Booking;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Booking Repository (Output Port)
 * 예약 저장소 인터페이스
 */
public interface BookingRepository {

    /**
     * 예약과 테이블 슬롯, 점유 정보를 하나의 단위로 저장
     * 같은 (테이블, 슬롯, 날짜)를 점유하는 예약이 이미 있으면 DataIntegrityViolationException
     *
     * @param booking 저장할 예약 (id가 null이면 신규)
     * @return 저장된 예약
     */
    Booking save(Booking booking);

    Optional<Booking> findById(Long bookingId);

    /**
     * 조건 검색 (null 조건은 무시)
     *
     * @param cafeId 카페 ID
     * @param userId 예약자 ID
     * @return 예약 목록 (예약 날짜 내림차순)
     */
    List<Booking> findAll(Long cafeId, Long userId);

    /**
     * 예약 날짜가 기준일 이전인 PENDING/CONFIRMED 예약을 COMPLETED, active=false 로 일괄 변경하고
     * 해당 날짜들의 점유 정보를 삭제
     *
     * @param today 기준일 (이 날짜 이전이 대상)
     * @param now 변경 시각
     * @return 마감된 예약 수
     */
    int expireBefore(LocalDate today, LocalDateTime now);
}
