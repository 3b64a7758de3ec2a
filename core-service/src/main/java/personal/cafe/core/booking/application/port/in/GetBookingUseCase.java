package personal.cafe.core.booking.application.port.in;

import personal.cafe.core.booking.domain.model.Booking;

import java.util.List;

/**
 * Get Booking UseCase (Input Port)
 * 예약 조회 유스케이스
 */
public interface GetBookingUseCase {

    /**
     * 예약 단건 조회
     * 고객은 본인 예약만 조회 가능
     *
     * @throws personal.cafe.core.booking.domain.exception.BookingNotFoundException 예약이 없을 때
     * @throws personal.cafe.core.booking.domain.exception.InsufficientPermissionsException 타인의 예약일 때
     */
    Booking getBooking(Long bookingId, Long userId);

    /**
     * 예약 목록 조회
     * 매니저/관리자가 showAll=true 로 요청한 경우에만 전체 예약을 조회하고,
     * 그 외에는 본인 예약만 조회
     *
     * @param userId       요청 사용자 ID
     * @param showAll      전체 조회 여부
     * @param cafeId       카페 필터 (nullable)
     * @param filterUserId 예약자 필터 (nullable, 전체 조회 시에만 적용)
     */
    List<Booking> getBookings(Long userId, boolean showAll, Long cafeId, Long filterUserId);
}
