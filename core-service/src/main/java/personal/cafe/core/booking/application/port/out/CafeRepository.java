package personal.cafe.core.booking.application.port.out;

import personal.cafe.core.booking.domain.model.Cafe;

import java.util.Optional;

/**
 * Cafe Repository (Output Port)
 */
public interface CafeRepository {

    Optional<Cafe> findById(Long cafeId);
}
