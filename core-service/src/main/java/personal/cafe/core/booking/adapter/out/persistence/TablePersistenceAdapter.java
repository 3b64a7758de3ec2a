package personal.cafe.core.booking.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.cafe.core.booking.application.port.out.TableRepository;
import personal.cafe.core.booking.domain.model.CafeTable;

import java.util.Optional;

/**
 * Table Persistence Adapter
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TablePersistenceAdapter implements TableRepository {

    private final JpaTableRepository jpaTableRepository;

    @Override
    public Optional<CafeTable> findById(Long tableId) {
        log.debug("Finding table: tableId={}", tableId);
        return jpaTableRepository.findById(tableId)
                .map(TableEntity::toDomain);
    }
}
