package personal.cafe.core.booking.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.cafe.core.booking.domain.model.TableSlotAssignment;

/**
 * Booking Table Slot JPA Entity
 * 예약에 포함된 (테이블, 슬롯) 매핑
 */
@Entity
@Table(name = "booking_table_slots",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_booking_table_slot",
                columnNames = {"booking_id", "table_id", "slot_id"}
        ))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class TableSlotEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "booking_id", nullable = false)
    private BookingEntity booking;

    @Column(name = "table_id", nullable = false)
    private Long tableId;

    @Column(name = "slot_id", nullable = false)
    private Long slotId;

    static TableSlotEntity of(BookingEntity booking, TableSlotAssignment assignment) {
        TableSlotEntity entity = new TableSlotEntity();
        entity.booking = booking;
        entity.tableId = assignment.tableId();
        entity.slotId = assignment.slotId();
        return entity;
    }

    public TableSlotAssignment toAssignment() {
        return TableSlotAssignment.of(tableId, slotId);
    }
}
