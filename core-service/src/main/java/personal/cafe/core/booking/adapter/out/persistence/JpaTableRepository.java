package personal.cafe.core.booking.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

/**
 * Spring Data JPA Repository for Cafe Table
 */
public interface JpaTableRepository extends JpaRepository<TableEntity, Long> {
}
