package personal.cafe.common.exception;

/**
 * 에러 분류
 * 클라이언트가 코드 단위가 아닌 범주 단위로 처리할 수 있도록 제공
 */
public enum ErrorType {
    VALIDATION,
    NOT_FOUND,
    INACTIVE_RESOURCE,
    CONFLICT,
    CAPACITY,
    PERMISSION,
    STATE,
    TEMPORAL,
    SYSTEM
}
