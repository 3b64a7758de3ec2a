package personal.cafe.core.booking.application.port.in;

import personal.cafe.core.booking.domain.model.Booking;

/**
 * Update Booking UseCase (Input Port)
 * 예약 수정 및 상태 변경 유스케이스
 */
public interface UpdateBookingUseCase {

    /**
     * 예약 부분 수정
     * 실제로 바뀌는 필드가 없으면 검증 없이 기존 예약을 그대로 반환
     *
     * @param command 수정 커맨드
     * @return 수정된 예약
     * @throws personal.cafe.core.booking.domain.exception.BookingNotFoundException 예약이 없을 때
     * @throws personal.cafe.core.booking.domain.exception.InsufficientPermissionsException 고객이 타인의 예약을 수정할 때
     * @throws personal.cafe.core.booking.domain.exception.BookingInactiveException 비활성 예약을 관리자가 아닌 사용자가 수정할 때
     * @throws personal.cafe.core.booking.domain.exception.InvalidStatusTransitionException 허용되지 않는 상태 변경일 때
     */
    Booking updateBooking(UpdateBookingCommand command);
}
