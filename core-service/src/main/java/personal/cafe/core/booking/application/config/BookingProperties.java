package personal.cafe.core.booking.application.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import personal.cafe.core.booking.domain.model.BookingStatus;
import personal.cafe.core.user.domain.model.UserRole;

import java.util.List;
import java.util.Map;

/**
 * Booking 설정 Properties
 * application.yml의 booking.* 설정을 바인딩
 */
@ConfigurationProperties(prefix = "booking")
public record BookingProperties(
        String timeZone,
        int lockTtlSeconds,
        Integer conflictRetries,
        Map<UserRole, Map<BookingStatus, List<BookingStatus>>> transitions,
        Events events
) {
    public BookingProperties {
        if (timeZone == null || timeZone.isBlank()) {
            timeZone = "Europe/Moscow";
        }
        if (lockTtlSeconds <= 0) {
            lockTtlSeconds = 10;
        }
        if (conflictRetries == null) {
            conflictRetries = 1;
        } else if (conflictRetries < 0) {
            conflictRetries = 0;
        }
        transitions = transitions == null ? Map.of() : transitions;
        events = events == null ? new Events(null) : events;
    }

    public record Events(
            String topicPrefix
    ) {
        public Events {
            if (topicPrefix == null || topicPrefix.isBlank()) {
                topicPrefix = "booking";
            }
        }
    }
}
