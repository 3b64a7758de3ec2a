package personal.cafe.core.booking.application.port.in;

/**
 * Expire Bookings UseCase (Input Port)
 * 예약 날짜가 지난 PENDING/CONFIRMED 예약을 COMPLETED로 마감하는 유스케이스
 */
public interface ExpireBookingsUseCase {

    /**
     * 오늘(booking.time-zone 기준) 이전 날짜의 점유 중 예약을 마감하고 점유 정보를 삭제
     * 스케줄러에 의해 주기적으로 호출됨
     *
     * @return 마감된 예약 수
     */
    int expireBookings();
}
