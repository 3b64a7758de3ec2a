package personal.cafe.core.user.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.cafe.core.user.application.port.out.UserRepository;
import personal.cafe.core.user.domain.model.User;

import java.util.Optional;

/**
 * User Persistence Adapter
 * users 테이블의 역할 플래그(is_superuser, is_manager)를 읽어 도메인 모델로 변환
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UserPersistenceAdapter implements UserRepository {

    private final JpaUserRepository jpaUserRepository;

    @Override
    public Optional<User> findById(Long userId) {
        Optional<User> user = jpaUserRepository.findById(userId)
                .map(UserEntity::toDomain);
        log.debug("User lookup: userId={}, found={}", userId, user.isPresent());
        return user;
    }
}
