package personal.cafe.core.user.application.port.out;

import personal.cafe.core.user.domain.model.User;

import java.util.Optional;

/**
 * User Repository (Output Port)
 * 사용자 관리는 외부 시스템 소관이며, 이 서비스는 역할 판별을 위한 조회만 수행
 */
public interface UserRepository {

    Optional<User> findById(Long userId);
}
