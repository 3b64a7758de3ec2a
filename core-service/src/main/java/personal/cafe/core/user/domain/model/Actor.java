package personal.cafe.core.user.domain.model;

import personal.cafe.common.exception.BusinessException;
import personal.cafe.common.exception.ErrorCode;

/**
 * Actor
 * 요청을 수행하는 사용자 식별자와 역할
 */
public record Actor(
        Long userId,
        UserRole role
) {
    public Actor {
        if (userId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Actor user ID cannot be null");
        }
        if (role == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Actor role cannot be null");
        }
    }

    public boolean isCustomer() {
        return role == UserRole.CUSTOMER;
    }

    public boolean isAdmin() {
        return role == UserRole.ADMIN;
    }
}
