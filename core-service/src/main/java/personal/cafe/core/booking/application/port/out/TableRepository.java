package personal.cafe.core.booking.application.port.out;

import personal.cafe.core.booking.domain.model.CafeTable;

import java.util.Optional;

/**
 * Table Repository (Output Port)
 */
public interface TableRepository {

    Optional<CafeTable> findById(Long tableId);
}
