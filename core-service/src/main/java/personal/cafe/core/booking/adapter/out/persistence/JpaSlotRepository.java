package personal.cafe.core.booking.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

/**
 * Spring Data JPA Repository for Slot
 */
public interface JpaSlotRepository extends JpaRepository<SlotEntity, Long> {
}
