package personal.cafe.core.user.domain.exception;

import personal.cafe.common.exception.BusinessException;
import personal.cafe.common.exception.ErrorCode;

/**
 * User Not Found Exception
 * 사용자를 찾을 수 없을 때 발생하는 예외
 */
public class UserNotFoundException extends BusinessException {
    private final Long userId;

    public UserNotFoundException(Long userId) {
        super(ErrorCode.USER_NOT_FOUND, String.format("User not found: userId=%d", userId));
        this.userId = userId;
    }

    public Long getUserId() {
        return userId;
    }
}
