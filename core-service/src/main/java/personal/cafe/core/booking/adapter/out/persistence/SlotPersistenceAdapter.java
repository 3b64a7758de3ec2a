package personal.cafe.core.booking.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.cafe.core.booking.application.port.out.SlotRepository;
import personal.cafe.core.booking.domain.model.Slot;

import java.util.Optional;

/**
 * Slot Persistence Adapter
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SlotPersistenceAdapter implements SlotRepository {

    private final JpaSlotRepository jpaSlotRepository;

    @Override
    public Optional<Slot> findById(Long slotId) {
        log.debug("Finding slot: slotId={}", slotId);
        return jpaSlotRepository.findById(slotId)
                .map(SlotEntity::toDomain);
    }
}
