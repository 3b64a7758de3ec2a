package personal.cafe.core.user.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

/**
 * Spring Data JPA Repository for User (읽기 전용 사용)
 */
public interface JpaUserRepository extends JpaRepository<UserEntity, Long> {
}
