package personal.cafe.core.user.domain.model;

import personal.cafe.common.exception.BusinessException;
import personal.cafe.common.exception.ErrorCode;

/**
 * User Domain Model
 * 사용자 도메인의 불변 모델
 */
public record User(
        Long id,
        String name,
        String email,
        boolean superuser,
        boolean manager
) {
    public User {
        if (id == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "User ID cannot be null");
        }
        if (name == null || name.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "User name cannot be null or blank");
        }
    }

    public UserRole role() {
        return UserRole.of(superuser, manager);
    }

    public Actor toActor() {
        return new Actor(id, role());
    }
}
