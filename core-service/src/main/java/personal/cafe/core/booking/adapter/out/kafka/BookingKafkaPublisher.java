package personal.cafe.core.booking.adapter.out.kafka;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;
import personal.cafe.common.exception.BusinessException;
import personal.cafe.common.exception.ErrorCode;
import personal.cafe.core.booking.application.config.BookingProperties;
import personal.cafe.core.booking.application.port.out.BookingEventPublisher;
import personal.cafe.core.booking.domain.model.BookingEvent;

/**
 * Booking Kafka Publisher (Adapter Layer)
 * Kafka를 통한 예약 알림 이벤트 발행 구현체
 * 토픽: {prefix}.created, {prefix}.updated, {prefix}.status-changed
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingKafkaPublisher implements BookingEventPublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final BookingProperties bookingProperties;

    @Override
    public void publish(BookingEvent event) {
        String topic = bookingProperties.events().topicPrefix() + "." + event.type().getTopicSuffix();
        String key = String.valueOf(event.booking().id());
        String payload = serialize(event);

        log.debug("Publishing booking event: topic={}, key={}", topic, key);
        kafkaTemplate.send(topic, key, payload)
                .whenComplete((result, ex) -> {
                    if (ex != null) {
                        log.error("Failed to publish booking event: topic={}, key={}", topic, key, ex);
                    } else {
                        log.debug("Booking event published: topic={}, key={}, offset={}",
                                topic, key, result.getRecordMetadata().offset());
                    }
                });
    }

    private String serialize(BookingEvent event) {
        try {
            return objectMapper.writeValueAsString(BookingEventMessage.from(event));
        } catch (JsonProcessingException e) {
            throw new BusinessException(ErrorCode.INTERNAL_SERVER_ERROR,
                    "Failed to serialize booking event: bookingId=" + event.booking().id());
        }
    }
}
