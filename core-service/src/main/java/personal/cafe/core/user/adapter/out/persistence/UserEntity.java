package personal.cafe.core.user.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.cafe.core.user.domain.model.User;

/**
 * User JPA Entity
 * 사용자 테이블 매핑 (계정 관리는 별도 서비스, 여기서는 조회만 수행)
 */
@Entity
@Table(name = "users")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class UserEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(length = 100)
    private String email;

    @Column(name = "is_superuser", nullable = false)
    private boolean superuser;

    @Column(name = "is_manager", nullable = false)
    private boolean manager;

    public User toDomain() {
        return new User(id, name, email, superuser, manager);
    }
}
