package personal.cafe.core.acceptance.steps;

import io.cucumber.java.en.And;
import io.cucumber.java.en.Given;
import io.cucumber.java.en.Then;
import io.cucumber.java.en.When;
import lombok.extern.slf4j.Slf4j;
import personal.cafe.common.exception.BusinessException;
import personal.cafe.core.acceptance.support.BookingTestAdapter;
import personal.cafe.core.booking.domain.model.Booking;
import personal.cafe.core.booking.domain.model.BookingPatch;
import personal.cafe.core.booking.domain.model.BookingStatus;

import java.util.Arrays;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static personal.cafe.core.booking.support.BookingFixtures.TODAY;
import static personal.cafe.core.booking.support.BookingFixtures.TOMORROW;

/**
 * Booking Acceptance Test Step Definitions
 * 비즈니스 관점의 자연어로 작성된 시나리오에 매핑
 */
@Slf4j
public class BookingAcceptanceSteps {

    private BookingTestAdapter bookingAdapter;
    private Booking currentBooking;
    private Booking lastBooking;
    private BusinessException lastError;

    // ==========================================
    // 배경
    // ==========================================

    @Given("예약 가능한 카페 테이블과 시간 슬롯이 있다")
    public void 예약_가능한_카페_테이블과_시간_슬롯이_있다() {
        log.info(">>> Given: 카페, 테이블, 슬롯 준비");
        bookingAdapter = new BookingTestAdapter();
    }

    // ==========================================
    // Given: 사전 상태
    // ==========================================

    @Given("{long}번 고객이 내일 테이블 {long}번 슬롯 {long}번을 예약했다")
    public void 고객이_예약했다(Long userId, Long tableId, Long slotId) {
        log.info(">>> Given: 기존 예약 생성");
        currentBooking = bookingAdapter.createBooking(userId, TOMORROW, tableId, slotId);
    }

    @Given("{long}번 고객의 어제 날짜 {string} 예약이 있다")
    public void 어제_날짜_예약이_있다(Long userId, String status) {
        log.info(">>> Given: 지난 날짜 예약 생성");
        currentBooking = bookingAdapter.storeBooking(
                userId, TODAY.minusDays(1), BookingStatus.valueOf(status), 10L, 100L);
    }

    // ==========================================
    // When: 사용자 행동
    // ==========================================

    @When("{long}번 고객이 내일 테이블 {long}번 슬롯 {long}번을 예약한다")
    public void 고객이_예약한다(Long userId, Long tableId, Long slotId) {
        log.info(">>> When: 예약 요청");
        attempt(() -> bookingAdapter.createBooking(userId, TOMORROW, tableId, slotId));
    }

    @When("{long}번 고객이 예약을 취소한다")
    public void 고객이_예약을_취소한다(Long userId) {
        log.info(">>> When: 예약 취소 요청");
        attempt(() -> bookingAdapter.updateBooking(userId, currentBooking.id(),
                new BookingPatch(null, null, null, null, BookingStatus.CANCELLED, null, null)));
    }

    @When("{long}번 고객이 예약 인원을 {int}명으로 변경한다")
    public void 고객이_예약_인원을_변경한다(Long userId, int guestNumber) {
        log.info(">>> When: 예약 인원 변경 요청");
        attempt(() -> bookingAdapter.updateBooking(userId, currentBooking.id(),
                new BookingPatch(null, null, guestNumber, null, null, null, null)));
    }

    @When("매니저가 예약을 확정한다")
    public void 매니저가_예약을_확정한다() {
        log.info(">>> When: 매니저 확정 요청");
        attempt(() -> bookingAdapter.updateBooking(BookingTestAdapter.MANAGER_ID, currentBooking.id(),
                new BookingPatch(null, null, null, null, BookingStatus.CONFIRMED, null, null)));
    }

    @When("지난 예약 마감 작업이 실행된다")
    public void 지난_예약_마감_작업이_실행된다() {
        log.info(">>> When: 예약 마감 작업 실행");
        int expiredCount = bookingAdapter.expireBookings();
        log.debug(">>> 마감된 예약 수: {}", expiredCount);
    }

    // ==========================================
    // Then: 결과 검증
    // ==========================================

    @Then("예약이 {string} 상태로 처리된다")
    public void 예약이_상태로_처리된다(String status) {
        assertThat(lastError).as("예약 요청 실패: %s", lastError).isNull();
        assertThat(lastBooking.status()).isEqualTo(BookingStatus.valueOf(status));
    }

    @Then("요청이 {string} 오류로 거절된다")
    public void 요청이_오류로_거절된다(String errorName) {
        assertThat(lastError).isNotNull();
        assertThat(lastError.getClass().getSimpleName()).isEqualTo(errorName);
    }

    @Then("기존 예약의 상태는 {string}이다")
    public void 기존_예약의_상태는(String status) {
        assertThat(bookingAdapter.findBooking(currentBooking.id()).status())
                .isEqualTo(BookingStatus.valueOf(status));
    }

    @And("기존 예약의 인원은 {int}명이다")
    public void 기존_예약의_인원은(int guestNumber) {
        assertThat(bookingAdapter.findBooking(currentBooking.id()).guestNumber()).isEqualTo(guestNumber);
    }

    @And("기존 예약은 비활성 상태이다")
    public void 기존_예약은_비활성_상태이다() {
        assertThat(bookingAdapter.findBooking(currentBooking.id()).active()).isFalse();
    }

    @And("점유 중인 예약은 {int}건이다")
    public void 점유_중인_예약은(int count) {
        assertThat(bookingAdapter.occupyingBookings()).hasSize(count);
    }

    @And("발행된 이벤트는 {string} 순서이다")
    public void 발행된_이벤트는_순서이다(String eventTypes) {
        assertThat(bookingAdapter.publishedEventTypes())
                .containsExactlyElementsOf(Arrays.stream(eventTypes.split(","))
                        .map(String::trim)
                        .toList());
    }

    private void attempt(Supplier<Booking> action) {
        lastBooking = null;
        lastError = null;
        try {
            lastBooking = action.get();
        } catch (BusinessException e) {
            log.debug(">>> 요청 거절 (예상된 동작일 수 있음): {}", e.getMessage());
            lastError = e;
        }
    }
}
