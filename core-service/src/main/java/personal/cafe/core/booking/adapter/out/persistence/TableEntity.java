package personal.cafe.core.booking.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.cafe.core.booking.domain.model.CafeTable;

/**
 * Cafe Table JPA Entity (조회 전용)
 */
@Entity
@Table(name = "cafe_tables")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class TableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "cafe_id", nullable = false)
    private Long cafeId;

    @Column(nullable = false)
    private int seats;

    @Column(nullable = false)
    private boolean active;

    public CafeTable toDomain() {
        return new CafeTable(id, cafeId, seats, active);
    }
}
