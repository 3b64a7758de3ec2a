package personal.cafe.core.booking.application.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import personal.cafe.core.booking.domain.model.BookingStatus;
import personal.cafe.core.booking.domain.model.StatusTransitionMatrix;
import personal.cafe.core.user.domain.model.UserRole;

import java.time.Clock;
import java.time.ZoneId;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Booking Configuration
 * 예약 날짜 기준 시계와 상태 전이 정책 Bean 등록
 */
@Slf4j
@Configuration
public class BookingConfig {

    /**
     * "오늘" 판단 기준 시계 (booking.time-zone)
     */
    @Bean
    public Clock bookingClock(BookingProperties properties) {
        return Clock.system(ZoneId.of(properties.timeZone()));
    }

    /**
     * booking.transitions 가 비어 있으면 기본 정책 사용
     */
    @Bean
    public StatusTransitionMatrix statusTransitionMatrix(BookingProperties properties) {
        if (properties.transitions().isEmpty()) {
            log.info("Using default booking status transitions");
            return StatusTransitionMatrix.defaults();
        }

        Map<UserRole, Map<BookingStatus, Set<BookingStatus>>> transitions = new EnumMap<>(UserRole.class);
        properties.transitions().forEach((role, byStatus) -> {
            Map<BookingStatus, Set<BookingStatus>> targets = new EnumMap<>(BookingStatus.class);
            byStatus.forEach((from, to) -> targets.put(from, to.isEmpty()
                    ? EnumSet.noneOf(BookingStatus.class)
                    : EnumSet.copyOf(to)));
            transitions.put(role, targets);
        });
        log.info("Using configured booking status transitions: {}", transitions);
        return StatusTransitionMatrix.of(transitions);
    }
}
