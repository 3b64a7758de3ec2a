package personal.cafe.core.booking.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static personal.cafe.core.booking.support.BookingFixtures.*;

@DisplayName("BookingPatch 단위 테스트")
class BookingPatchTest {

    private final Booking current = booking(1L, 7L, BookingStatus.PENDING,
            assignment(10L, 100L), assignment(11L, 100L));

    @Test
    @DisplayName("현재 값과 같은 필드만 전달하면 변경분이 비어 있다")
    void sameValuesProduceEmptyDiff() {
        // given
        BookingPatch patch = new BookingPatch(
                current.cafeId(),
                current.bookingDate(),
                current.guestNumber(),
                current.note(),
                current.status(),
                current.active(),
                Set.of(assignment(11L, 100L), assignment(10L, 100L)));

        // when
        BookingPatch diff = patch.diff(current);

        // then
        assertThat(diff.isEmpty()).isTrue();
        assertThat(diff.changesAvailabilityInputs()).isFalse();
        assertThat(diff.changesStatusOrActive()).isFalse();
    }

    @Test
    @DisplayName("실제로 바뀐 필드만 변경분에 남는다")
    void keepsOnlyChangedFields() {
        // given
        BookingPatch patch = new BookingPatch(
                current.cafeId(), TOMORROW.plusDays(3), current.guestNumber(), null,
                BookingStatus.CANCELLED, null, null);

        // when
        BookingPatch diff = patch.diff(current);

        // then
        assertThat(diff.cafeId()).isNull();
        assertThat(diff.guestNumber()).isNull();
        assertThat(diff.bookingDate()).isEqualTo(TOMORROW.plusDays(3));
        assertThat(diff.status()).isEqualTo(BookingStatus.CANCELLED);
        assertThat(diff.changesAvailabilityInputs()).isTrue();
        assertThat(diff.changesStatusOrActive()).isTrue();
    }

    @Test
    @DisplayName("인원 수 변경은 가용성 재검증 대상이다")
    void guestNumberChangeRequiresAvailabilityCheck() {
        BookingPatch diff = new BookingPatch(null, null, 5, null, null, null, null).diff(current);

        assertThat(diff.changesAvailabilityInputs()).isTrue();
    }

    @Test
    @DisplayName("메모만 바뀌면 가용성 재검증 대상이 아니다")
    void noteChangeDoesNotRequireAvailabilityCheck() {
        BookingPatch diff = new BookingPatch(null, null, null, "유모차 있음", null, null, null).diff(current);

        assertThat(diff.isEmpty()).isFalse();
        assertThat(diff.changesAvailabilityInputs()).isFalse();
    }

    @Test
    @DisplayName("변경분 적용 시 전달되지 않은 필드는 유지된다")
    void withChangesKeepsUntouchedFields() {
        // given
        BookingPatch diff = new BookingPatch(null, null, 4, null, null, null,
                Set.of(assignment(12L, 101L))).diff(current);

        // when
        Booking updated = current.withChanges(diff, current.status(), current.active(), NOW);

        // then
        assertThat(updated.id()).isEqualTo(current.id());
        assertThat(updated.userId()).isEqualTo(current.userId());
        assertThat(updated.note()).isEqualTo(current.note());
        assertThat(updated.guestNumber()).isEqualTo(4);
        assertThat(updated.tableSlots()).containsExactly(assignment(12L, 101L));
        assertThat(updated.createdAt()).isEqualTo(current.createdAt());
        assertThat(updated.updatedAt()).isEqualTo(NOW);
    }
}
