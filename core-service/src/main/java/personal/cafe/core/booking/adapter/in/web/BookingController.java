package personal.cafe.core.booking.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.cafe.core.booking.adapter.in.web.dto.BookingResponse;
import personal.cafe.core.booking.adapter.in.web.dto.CreateBookingRequest;
import personal.cafe.core.booking.adapter.in.web.dto.UpdateBookingRequest;
import personal.cafe.core.booking.application.port.in.CreateBookingUseCase;
import personal.cafe.core.booking.application.port.in.GetBookingUseCase;
import personal.cafe.core.booking.application.port.in.UpdateBookingUseCase;
import personal.cafe.core.booking.domain.model.Booking;

import java.util.List;

/**
 * Booking API Controller
 * 예약 생성, 조회, 수정 REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/bookings")
@RequiredArgsConstructor
public class BookingController {

    private final CreateBookingUseCase createBookingUseCase;
    private final UpdateBookingUseCase updateBookingUseCase;
    private final GetBookingUseCase getBookingUseCase;

    /**
     * 예약 생성
     * POST /api/v1/bookings
     */
    @PostMapping
    public ResponseEntity<BookingResponse> createBooking(
            @Valid @RequestBody CreateBookingRequest request,
            @RequestHeader("X-User-Id") Long userId
    ) {
        log.info("Create booking: userId={}, cafeId={}, date={}, guests={}",
                userId, request.cafeId(), request.bookingDate(), request.guestNumber());

        Booking booking = createBookingUseCase.createBooking(request.toCommand(userId));

        return ResponseEntity.status(HttpStatus.CREATED).body(BookingResponse.from(booking));
    }

    /**
     * 예약 목록 조회
     * GET /api/v1/bookings?showAll=&cafeId=&userId=
     */
    @GetMapping
    public ResponseEntity<List<BookingResponse>> getBookings(
            @RequestHeader("X-User-Id") Long userId,
            @RequestParam(defaultValue = "false") boolean showAll,
            @RequestParam(required = false) Long cafeId,
            @RequestParam(name = "userId", required = false) Long filterUserId
    ) {
        log.info("Get bookings: userId={}, showAll={}, cafeId={}, filterUserId={}",
                userId, showAll, cafeId, filterUserId);

        List<BookingResponse> response = getBookingUseCase.getBookings(userId, showAll, cafeId, filterUserId)
                .stream()
                .map(BookingResponse::from)
                .toList();

        return ResponseEntity.ok(response);
    }

    /**
     * 예약 조회
     * GET /api/v1/bookings/{bookingId}
     */
    @GetMapping("/{bookingId}")
    public ResponseEntity<BookingResponse> getBooking(
            @PathVariable Long bookingId,
            @RequestHeader("X-User-Id") Long userId
    ) {
        log.info("Get booking: bookingId={}, userId={}", bookingId, userId);

        Booking booking = getBookingUseCase.getBooking(bookingId, userId);

        return ResponseEntity.ok(BookingResponse.from(booking));
    }

    /**
     * 예약 수정 (부분 수정, 상태 변경 포함)
     * PATCH /api/v1/bookings/{bookingId}
     */
    @PatchMapping("/{bookingId}")
    public ResponseEntity<BookingResponse> updateBooking(
            @PathVariable Long bookingId,
            @Valid @RequestBody UpdateBookingRequest request,
            @RequestHeader("X-User-Id") Long userId
    ) {
        log.info("Update booking: bookingId={}, userId={}, status={}", bookingId, userId, request.status());

        Booking booking = updateBookingUseCase.updateBooking(request.toCommand(userId, bookingId));

        return ResponseEntity.ok(BookingResponse.from(booking));
    }
}
