package personal.cafe.core.booking.application.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import personal.cafe.core.booking.domain.model.BookingStatus;
import personal.cafe.core.booking.domain.model.StatusTransitionMatrix;
import personal.cafe.core.user.domain.model.UserRole;

import java.time.Clock;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("BookingConfig 단위 테스트")
class BookingConfigTest {

    private final BookingConfig bookingConfig = new BookingConfig();

    @Test
    @DisplayName("설정값이 없으면 기본값이 적용된다")
    void properties_Defaults() {
        BookingProperties properties = new BookingProperties(null, 0, null, null, null);

        assertThat(properties.timeZone()).isEqualTo("Europe/Moscow");
        assertThat(properties.lockTtlSeconds()).isEqualTo(10);
        assertThat(properties.conflictRetries()).isEqualTo(1);
        assertThat(properties.transitions()).isEmpty();
        assertThat(properties.events().topicPrefix()).isEqualTo("booking");
    }

    @Test
    @DisplayName("음수 재시도 횟수는 0으로 보정되고 0은 그대로 유지된다")
    void properties_ConflictRetriesLowerBound() {
        assertThat(new BookingProperties(null, 10, -1, null, null).conflictRetries()).isZero();
        assertThat(new BookingProperties(null, 10, 0, null, null).conflictRetries()).isZero();
    }

    @Test
    @DisplayName("시계는 booking.time-zone 을 따른다")
    void bookingClock_UsesConfiguredZone() {
        BookingProperties properties = new BookingProperties("Asia/Seoul", 10, 1, Map.of(), null);

        Clock clock = bookingConfig.bookingClock(properties);

        assertThat(clock.getZone()).isEqualTo(ZoneId.of("Asia/Seoul"));
    }

    @Test
    @DisplayName("전이 설정이 비어 있으면 기본 정책을 사용한다")
    void statusTransitionMatrix_Defaults() {
        BookingProperties properties = new BookingProperties("Europe/Moscow", 10, 1, Map.of(), null);

        StatusTransitionMatrix matrix = bookingConfig.statusTransitionMatrix(properties);

        assertThat(matrix.allows(UserRole.CUSTOMER, BookingStatus.PENDING, BookingStatus.CANCELLED)).isTrue();
        assertThat(matrix.allows(UserRole.CUSTOMER, BookingStatus.PENDING, BookingStatus.CONFIRMED)).isFalse();
        assertThat(matrix.allows(UserRole.MANAGER, BookingStatus.CONFIRMED, BookingStatus.COMPLETED)).isTrue();
    }

    @Test
    @DisplayName("설정된 전이 정책이 기본 정책을 대체한다")
    void statusTransitionMatrix_Configured() {
        // given
        Map<UserRole, Map<BookingStatus, List<BookingStatus>>> transitions = Map.of(
                UserRole.CUSTOMER, Map.of(
                        BookingStatus.PENDING, List.of(BookingStatus.CANCELLED),
                        BookingStatus.CONFIRMED, List.of(BookingStatus.CANCELLED)),
                UserRole.MANAGER, Map.of(
                        BookingStatus.PENDING, List.of()));
        BookingProperties properties = new BookingProperties("Europe/Moscow", 10, 1, transitions, null);

        // when
        StatusTransitionMatrix matrix = bookingConfig.statusTransitionMatrix(properties);

        // then
        assertThat(matrix.allows(UserRole.CUSTOMER, BookingStatus.CONFIRMED, BookingStatus.CANCELLED)).isTrue();
        assertThat(matrix.allows(UserRole.MANAGER, BookingStatus.PENDING, BookingStatus.CONFIRMED)).isFalse();
        assertThat(matrix.allowedTargets(UserRole.MANAGER, BookingStatus.PENDING)).isEmpty();
        assertThat(matrix.allows(UserRole.ADMIN, BookingStatus.CANCELLED, BookingStatus.CONFIRMED)).isFalse();
    }
}
