package personal.cafe.core.booking.domain.model;

/**
 * Cafe (조회 전용)
 */
public record Cafe(
        Long id,
        String name,
        boolean active
) {
}
