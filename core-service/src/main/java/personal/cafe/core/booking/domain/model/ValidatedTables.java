package personal.cafe.core.booking.domain.model;

import java.util.Set;

/**
 * 검증을 통과한 테이블 집합과 총 좌석 수
 */
public record ValidatedTables(
        Set<CafeTable> tables,
        int totalSeats
) {
    public ValidatedTables {
        tables = Set.copyOf(tables);
    }

    public static ValidatedTables of(Set<CafeTable> tables) {
        int totalSeats = tables.stream()
                .mapToInt(CafeTable::seats)
                .sum();
        return new ValidatedTables(tables, totalSeats);
    }
}
