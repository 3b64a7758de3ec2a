package personal.cafe.core.booking.application.port.in;

import personal.cafe.core.booking.domain.model.Booking;

/**
 * Create Booking UseCase (Input Port)
 * 예약 생성 유스케이스
 */
public interface CreateBookingUseCase {

    /**
     * 예약 생성
     * 날짜/인원/카페 검증 후 테이블 슬롯 가용성을 확인하고 PENDING 상태로 저장
     *
     * @param command 생성 커맨드
     * @return 생성된 예약
     * @throws personal.cafe.core.booking.domain.exception.BookingPastDateException 예약 날짜가 오늘 이전일 때
     * @throws personal.cafe.core.booking.domain.exception.CafeNotFoundException 카페가 없을 때
     * @throws personal.cafe.core.booking.domain.exception.TableAlreadyBookedException 테이블 슬롯이 이미 점유되었을 때 (409)
     * @throws personal.cafe.core.booking.domain.exception.UserAlreadyBookedException 같은 시간대에 이미 예약이 있을 때 (409)
     * @throws personal.cafe.core.booking.domain.exception.NotEnoughSeatsException 좌석 수가 부족할 때
     * @throws personal.cafe.core.booking.domain.exception.ConcurrentBookingException 같은 사용자/날짜에 쓰기가 진행 중일 때 (409)
     */
    Booking createBooking(CreateBookingCommand command);
}
