package personal.cafe.core.booking.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.cafe.core.booking.application.port.out.CafeRepository;
import personal.cafe.core.booking.domain.model.Cafe;

import java.util.Optional;

/**
 * Cafe Persistence Adapter
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CafePersistenceAdapter implements CafeRepository {

    private final JpaCafeRepository jpaCafeRepository;

    @Override
    public Optional<Cafe> findById(Long cafeId) {
        log.debug("Finding cafe: cafeId={}", cafeId);
        return jpaCafeRepository.findById(cafeId)
                .map(CafeEntity::toDomain);
    }
}
