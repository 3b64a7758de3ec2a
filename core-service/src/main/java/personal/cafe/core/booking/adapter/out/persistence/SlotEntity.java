package personal.cafe.core.booking.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.cafe.core.booking.domain.model.Slot;
import personal.cafe.core.booking.domain.model.TimeInterval;

import java.time.LocalTime;

/**
 * Slot JPA Entity (조회 전용)
 */
@Entity
@Table(name = "slots")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class SlotEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "cafe_id", nullable = false)
    private Long cafeId;

    @Column(name = "start_time", nullable = false)
    private LocalTime startTime;

    @Column(name = "end_time", nullable = false)
    private LocalTime endTime;

    @Column(nullable = false)
    private boolean active;

    public TimeInterval toInterval() {
        return TimeInterval.of(startTime, endTime);
    }

    public Slot toDomain() {
        return new Slot(id, cafeId, toInterval(), active);
    }
}
