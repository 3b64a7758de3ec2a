package personal.cafe.core.booking.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.cafe.core.booking.domain.model.Booking;
import personal.cafe.core.booking.domain.model.BookingStatus;
import personal.cafe.core.booking.domain.model.TableSlotAssignment;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Booking JPA Entity
 * 예약 테이블 매핑, 테이블 슬롯은 예약이 소유
 */
@Entity
@Table(name = "bookings",
        indexes = {
                @Index(name = "idx_bookings_user_date", columnList = "user_id, booking_date"),
                @Index(name = "idx_bookings_cafe", columnList = "cafe_id")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BookingEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "cafe_id", nullable = false)
    private Long cafeId;

    @Column(name = "booking_date", nullable = false)
    private LocalDate bookingDate;

    @Column(name = "guest_number", nullable = false)
    private int guestNumber;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private BookingStatus status;

    @Column(nullable = false)
    private boolean active;

    @Column(length = Booking.MAX_NOTE_LENGTH)
    private String note;

    @OneToMany(mappedBy = "booking", cascade = CascadeType.ALL, orphanRemoval = true)
    private Set<TableSlotEntity> tableSlots = new HashSet<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Version
    private Long version;

    /**
     * 도메인 모델로부터 신규 엔티티 생성
     */
    public static BookingEntity fromDomain(Booking booking) {
        BookingEntity entity = new BookingEntity();
        entity.userId = booking.userId();
        entity.createdAt = booking.createdAt();
        entity.update(booking);
        return entity;
    }

    /**
     * 영속 상태의 엔티티에 도메인 변경분 반영
     * 테이블 슬롯은 추가/삭제된 쌍만 반영
     */
    public void update(Booking booking) {
        this.cafeId = booking.cafeId();
        this.bookingDate = booking.bookingDate();
        this.guestNumber = booking.guestNumber();
        this.status = booking.status();
        this.active = booking.active();
        this.note = booking.note();
        this.updatedAt = booking.updatedAt();

        Set<TableSlotAssignment> requested = booking.tableSlots();
        tableSlots.removeIf(slot -> !requested.contains(slot.toAssignment()));
        Set<TableSlotAssignment> existing = toAssignments();
        requested.stream()
                .filter(assignment -> !existing.contains(assignment))
                .forEach(assignment -> tableSlots.add(TableSlotEntity.of(this, assignment)));
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }

    /**
     * 도메인 모델로 변환
     */
    public Booking toDomain() {
        return new Booking(id, userId, cafeId, bookingDate, guestNumber, status, active, note,
                toAssignments(), createdAt, updatedAt);
    }

    private Set<TableSlotAssignment> toAssignments() {
        return tableSlots.stream()
                .map(TableSlotEntity::toAssignment)
                .collect(Collectors.toSet());
    }
}
