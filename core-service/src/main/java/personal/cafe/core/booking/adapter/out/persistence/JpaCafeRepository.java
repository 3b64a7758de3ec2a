package personal.cafe.core.booking.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

/**
 * Spring Data JPA Repository for Cafe
 */
public interface JpaCafeRepository extends JpaRepository<CafeEntity, Long> {
}
