package personal.cafe.core.booking.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.cafe.core.booking.domain.model.TableSlotAssignment;

import java.time.LocalDate;

/**
 * Table Slot Occupancy JPA Entity
 * 점유 중인 예약의 (테이블, 슬롯, 날짜)만 기록
 * Unique Index (table_id, slot_id, booking_date)가 이중 예약의 최종 방어선
 */
@Entity
@Table(name = "table_slot_occupancies",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_table_slot_date",
                columnNames = {"table_id", "slot_id", "booking_date"}
        ),
        indexes = @Index(name = "idx_occupancies_booking", columnList = "booking_id"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OccupancyEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "booking_id", nullable = false)
    private Long bookingId;

    @Column(name = "table_id", nullable = false)
    private Long tableId;

    @Column(name = "slot_id", nullable = false)
    private Long slotId;

    @Column(name = "booking_date", nullable = false)
    private LocalDate bookingDate;

    public static OccupancyEntity of(Long bookingId, TableSlotAssignment assignment, LocalDate bookingDate) {
        OccupancyEntity entity = new OccupancyEntity();
        entity.bookingId = bookingId;
        entity.tableId = assignment.tableId();
        entity.slotId = assignment.slotId();
        entity.bookingDate = bookingDate;
        return entity;
    }
}
