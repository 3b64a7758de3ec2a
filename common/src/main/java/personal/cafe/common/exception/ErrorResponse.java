package personal.cafe.common.exception;

/**
 * 에러 응답 DTO
 */
public record ErrorResponse(
        String code,
        ErrorType type,
        String message
) {
    public static ErrorResponse of(ErrorCode errorCode, String message) {
        return new ErrorResponse(errorCode.getCode(), errorCode.getType(), message);
    }
}
