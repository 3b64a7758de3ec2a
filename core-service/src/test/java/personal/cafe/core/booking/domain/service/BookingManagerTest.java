package personal.cafe.core.booking.domain.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.cafe.core.booking.application.port.in.CreateBookingCommand;
import personal.cafe.core.booking.application.port.out.BookingRepository;
import personal.cafe.core.booking.application.port.out.CafeRepository;
import personal.cafe.core.booking.domain.exception.BookingInactiveException;
import personal.cafe.core.booking.domain.exception.BookingNotFoundException;
import personal.cafe.core.booking.domain.exception.BookingPastDateException;
import personal.cafe.core.booking.domain.exception.CafeInactiveException;
import personal.cafe.core.booking.domain.exception.CafeNotFoundException;
import personal.cafe.core.booking.domain.exception.CannotDeactivateActiveStatusException;
import personal.cafe.core.booking.domain.exception.InsufficientPermissionsException;
import personal.cafe.core.booking.domain.model.Booking;
import personal.cafe.core.booking.domain.model.BookingChange;
import personal.cafe.core.booking.domain.model.BookingPatch;
import personal.cafe.core.booking.domain.model.BookingStatus;
import personal.cafe.core.booking.domain.model.Cafe;
import personal.cafe.core.booking.domain.model.StatusTransitionMatrix;
import personal.cafe.core.user.domain.model.Actor;
import personal.cafe.core.user.domain.model.UserRole;

import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static personal.cafe.core.booking.support.BookingFixtures.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("BookingManager 단위 테스트")
class BookingManagerTest {

    private static final Long OWNER_ID = 7L;
    private static final Long BOOKING_ID = 55L;

    private final Actor owner = new Actor(OWNER_ID, UserRole.CUSTOMER);
    private final Actor stranger = new Actor(8L, UserRole.CUSTOMER);
    private final Actor manager = new Actor(20L, UserRole.MANAGER);
    private final Actor admin = new Actor(30L, UserRole.ADMIN);

    @Mock
    private BookingRepository bookingRepository;
    @Mock
    private CafeRepository cafeRepository;
    @Mock
    private BookingValidator bookingValidator;

    private BookingManager bookingManager;

    @BeforeEach
    void setUp() {
        bookingManager = new BookingManager(
                bookingRepository,
                cafeRepository,
                bookingValidator,
                new BookingLifecycle(StatusTransitionMatrix.defaults()),
                CLOCK);
    }

    private CreateBookingCommand createCommand() {
        return new CreateBookingCommand(OWNER_ID, CAFE_ID, TOMORROW, 2, "생일 모임", Set.of(assignment(10L, 100L)));
    }

    private void givenSaveReturnsArgument() {
        given(bookingRepository.save(any(Booking.class))).willAnswer(invocation -> invocation.getArgument(0));
    }

    @Test
    @DisplayName("예약 생성 성공 - PENDING 상태로 저장된다")
    void createInTransaction_Success() {
        // given
        given(cafeRepository.findById(CAFE_ID)).willReturn(Optional.of(new Cafe(CAFE_ID, "Blue Bottle", true)));
        givenSaveReturnsArgument();

        // when
        Booking result = bookingManager.createInTransaction(createCommand(), owner);

        // then
        assertThat(result.userId()).isEqualTo(OWNER_ID);
        assertThat(result.status()).isEqualTo(BookingStatus.PENDING);
        assertThat(result.active()).isTrue();
        assertThat(result.createdAt()).isEqualTo(NOW);
        verify(bookingValidator).validateBookingDate(TOMORROW);
        verify(bookingValidator).validateGuestNumber(2);
        verify(bookingValidator).validateAssignments(
                Set.of(assignment(10L, 100L)), CAFE_ID, TOMORROW, OWNER_ID, 2, null);
    }

    @Test
    @DisplayName("예약 생성 실패 - 카페 없음")
    void createInTransaction_CafeNotFound() {
        given(cafeRepository.findById(CAFE_ID)).willReturn(Optional.empty());

        assertThatThrownBy(() -> bookingManager.createInTransaction(createCommand(), owner))
                .isInstanceOf(CafeNotFoundException.class);
        verify(bookingRepository, never()).save(any());
    }

    @Test
    @DisplayName("예약 생성 실패 - 비활성 카페")
    void createInTransaction_CafeInactive() {
        given(cafeRepository.findById(CAFE_ID)).willReturn(Optional.of(new Cafe(CAFE_ID, "Closed", false)));

        assertThatThrownBy(() -> bookingManager.createInTransaction(createCommand(), owner))
                .isInstanceOf(CafeInactiveException.class);
        verify(bookingValidator, never()).validateAssignments(any(), any(), any(), any(), anyInt(), any());
    }

    @Test
    @DisplayName("예약 생성 실패 - 날짜 검증 실패 시 카페를 조회하지 않는다")
    void createInTransaction_PastDate() {
        willThrow(new BookingPastDateException(TOMORROW, TODAY)).given(bookingValidator).validateBookingDate(TOMORROW);

        assertThatThrownBy(() -> bookingManager.createInTransaction(createCommand(), owner))
                .isInstanceOf(BookingPastDateException.class);
        verifyNoInteractions(cafeRepository, bookingRepository);
    }

    @Test
    @DisplayName("예약 수정 실패 - 예약 없음")
    void updateInTransaction_NotFound() {
        given(bookingRepository.findById(BOOKING_ID)).willReturn(Optional.empty());

        assertThatThrownBy(() -> bookingManager.updateInTransaction(BOOKING_ID, BookingPatch.empty(), owner))
                .isInstanceOf(BookingNotFoundException.class);
    }

    @Test
    @DisplayName("예약 수정 실패 - 고객이 타인의 예약 수정")
    void updateInTransaction_OtherCustomer() {
        given(bookingRepository.findById(BOOKING_ID)).willReturn(Optional.of(pendingBooking(BOOKING_ID, OWNER_ID)));

        BookingPatch patch = new BookingPatch(null, null, null, null, BookingStatus.CANCELLED, null, null);

        assertThatThrownBy(() -> bookingManager.updateInTransaction(BOOKING_ID, patch, stranger))
                .isInstanceOf(InsufficientPermissionsException.class);
        verify(bookingRepository, never()).save(any());
    }

    @Test
    @DisplayName("현재 값과 같은 패치는 검증 없이 기존 예약을 반환한다")
    void updateInTransaction_NoOp() {
        // given
        Booking current = pendingBooking(BOOKING_ID, OWNER_ID);
        given(bookingRepository.findById(BOOKING_ID)).willReturn(Optional.of(current));
        BookingPatch patch = new BookingPatch(current.cafeId(), current.bookingDate(), current.guestNumber(),
                current.note(), current.status(), current.active(), current.tableSlots());

        // when
        BookingChange change = bookingManager.updateInTransaction(BOOKING_ID, patch, owner);

        // then
        assertThat(change.isChanged()).isFalse();
        assertThat(change.after()).isSameAs(current);
        verifyNoInteractions(bookingValidator, cafeRepository);
        verify(bookingRepository, never()).save(any());
    }

    @Test
    @DisplayName("고객이 본인의 PENDING 예약을 취소하면 active=false 가 된다")
    void updateInTransaction_CustomerCancelsOwnBooking() {
        // given
        given(bookingRepository.findById(BOOKING_ID)).willReturn(Optional.of(pendingBooking(BOOKING_ID, OWNER_ID)));
        givenSaveReturnsArgument();
        BookingPatch patch = new BookingPatch(null, null, null, null, BookingStatus.CANCELLED, null, null);

        // when
        BookingChange change = bookingManager.updateInTransaction(BOOKING_ID, patch, owner);

        // then
        assertThat(change.after().status()).isEqualTo(BookingStatus.CANCELLED);
        assertThat(change.after().active()).isFalse();
        assertThat(change.after().updatedAt()).isEqualTo(NOW);
        verify(bookingValidator, never()).validateAssignments(any(), any(), any(), any(), anyInt(), any());
    }

    @Test
    @DisplayName("매니저가 PENDING 예약을 확정하면 active=true 가 유지된다")
    void updateInTransaction_ManagerConfirms() {
        // given
        given(bookingRepository.findById(BOOKING_ID)).willReturn(Optional.of(pendingBooking(BOOKING_ID, OWNER_ID)));
        givenSaveReturnsArgument();
        BookingPatch patch = new BookingPatch(null, null, null, null, BookingStatus.CONFIRMED, null, null);

        // when
        BookingChange change = bookingManager.updateInTransaction(BOOKING_ID, patch, manager);

        // then
        assertThat(change.before().status()).isEqualTo(BookingStatus.PENDING);
        assertThat(change.after().status()).isEqualTo(BookingStatus.CONFIRMED);
        assertThat(change.after().active()).isTrue();
    }

    @Test
    @DisplayName("상태와 모순되는 active 값은 덮어쓰지 않고 거절한다")
    void updateInTransaction_InconsistentActive() {
        given(bookingRepository.findById(BOOKING_ID)).willReturn(Optional.of(pendingBooking(BOOKING_ID, OWNER_ID)));
        BookingPatch patch = new BookingPatch(null, null, null, null, BookingStatus.CONFIRMED, false, null);

        assertThatThrownBy(() -> bookingManager.updateInTransaction(BOOKING_ID, patch, manager))
                .isInstanceOf(CannotDeactivateActiveStatusException.class);
        verify(bookingRepository, never()).save(any());
    }

    @Test
    @DisplayName("관리자가 아닌 사용자는 비활성 예약을 수정할 수 없다")
    void updateInTransaction_InactiveBooking() {
        Booking cancelled = booking(BOOKING_ID, OWNER_ID, BookingStatus.CANCELLED, assignment(10L, 100L));
        given(bookingRepository.findById(BOOKING_ID)).willReturn(Optional.of(cancelled));
        BookingPatch patch = new BookingPatch(null, null, null, "메모 수정", null, null, null);

        assertThatThrownBy(() -> bookingManager.updateInTransaction(BOOKING_ID, patch, manager))
                .isInstanceOf(BookingInactiveException.class);
    }

    @Test
    @DisplayName("관리자가 취소된 예약을 다시 확정하면 가용성을 재검증한다")
    void updateInTransaction_AdminReactivates() {
        // given
        Booking cancelled = booking(BOOKING_ID, OWNER_ID, BookingStatus.CANCELLED, assignment(10L, 100L));
        given(bookingRepository.findById(BOOKING_ID)).willReturn(Optional.of(cancelled));
        givenSaveReturnsArgument();
        BookingPatch patch = new BookingPatch(null, null, null, null, BookingStatus.CONFIRMED, null, null);

        // when
        BookingChange change = bookingManager.updateInTransaction(BOOKING_ID, patch, admin);

        // then
        assertThat(change.after().isOccupying()).isTrue();
        verify(bookingValidator).validateAssignments(
                cancelled.tableSlots(), CAFE_ID, TOMORROW, OWNER_ID, cancelled.guestNumber(), BOOKING_ID);
    }

    @Test
    @DisplayName("매니저가 테이블 슬롯을 바꾸면 예약 소유자 기준으로 재검증한다")
    void updateInTransaction_ManagerChangesTables() {
        // given
        given(bookingRepository.findById(BOOKING_ID)).willReturn(Optional.of(pendingBooking(BOOKING_ID, OWNER_ID)));
        givenSaveReturnsArgument();
        BookingPatch patch = new BookingPatch(null, null, null, null, null, null, Set.of(assignment(11L, 101L)));

        // when
        BookingChange change = bookingManager.updateInTransaction(BOOKING_ID, patch, manager);

        // then
        assertThat(change.after().tableSlots()).containsExactly(assignment(11L, 101L));
        verify(bookingValidator).validateAssignments(
                eq(Set.of(assignment(11L, 101L))), eq(CAFE_ID), eq(TOMORROW), eq(OWNER_ID), anyInt(), eq(BOOKING_ID));
    }

    @Test
    @DisplayName("날짜와 카페 변경 시 필드별 검증 후 재검증한다")
    void updateInTransaction_DateAndCafeChange() {
        // given
        given(bookingRepository.findById(BOOKING_ID)).willReturn(Optional.of(pendingBooking(BOOKING_ID, OWNER_ID)));
        given(cafeRepository.findById(OTHER_CAFE_ID)).willReturn(Optional.of(new Cafe(OTHER_CAFE_ID, "Annex", true)));
        givenSaveReturnsArgument();
        BookingPatch patch = new BookingPatch(OTHER_CAFE_ID, TOMORROW.plusDays(1), null, null, null, null, null);

        // when
        BookingChange change = bookingManager.updateInTransaction(BOOKING_ID, patch, owner);

        // then
        assertThat(change.after().cafeId()).isEqualTo(OTHER_CAFE_ID);
        verify(bookingValidator).validateBookingDate(TOMORROW.plusDays(1));
        verify(bookingValidator).validateAssignments(
                any(), eq(OTHER_CAFE_ID), eq(TOMORROW.plusDays(1)), eq(OWNER_ID), anyInt(), anyLong());
    }
}
