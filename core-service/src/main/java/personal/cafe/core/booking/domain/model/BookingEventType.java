package personal.cafe.core.booking.domain.model;

/**
 * 예약 알림 이벤트 종류
 */
public enum BookingEventType {
    CREATED("created"),
    UPDATED("updated"),
    STATUS_CHANGED("status-changed");

    private final String topicSuffix;

    BookingEventType(String topicSuffix) {
        this.topicSuffix = topicSuffix;
    }

    public String getTopicSuffix() {
        return topicSuffix;
    }
}
