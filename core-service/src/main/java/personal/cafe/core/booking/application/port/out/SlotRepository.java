package personal.cafe.core.booking.application.port.out;

import personal.cafe.core.booking.domain.model.Slot;

import java.util.Optional;

/**
 * Slot Repository (Output Port)
 */
public interface SlotRepository {

    Optional<Slot> findById(Long slotId);
}
