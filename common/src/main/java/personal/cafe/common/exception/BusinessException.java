package personal.cafe.common.exception;

/**
 * Business Exception
 * 도메인 규칙 위반으로 요청을 거절할 때 사용하는 최상위 예외
 * 상세 메시지는 로그용, 클라이언트에는 ErrorCode의 메시지가 노출됨
 */
public class BusinessException extends RuntimeException {

    private final ErrorCode errorCode;

    public BusinessException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String detail) {
        super(detail);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
