package personal.cafe.common.exception;

import org.springframework.http.HttpStatus;

/**
 * 에러 코드 정의
 * HTTP Status Code, 에러 분류, 메시지를 함께 관리
 */
public enum ErrorCode {
    // Common (Cxxx)
    INVALID_INPUT(HttpStatus.BAD_REQUEST, ErrorType.VALIDATION, "C001", "잘못된 입력값입니다."),
    NOT_FOUND(HttpStatus.NOT_FOUND, ErrorType.NOT_FOUND, "C002", "요청한 리소스를 찾을 수 없습니다."),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, ErrorType.SYSTEM, "C003", "서버 내부 오류가 발생했습니다."),

    // User Domain (Uxxx)
    USER_NOT_FOUND(HttpStatus.NOT_FOUND, ErrorType.NOT_FOUND, "U001", "사용자를 찾을 수 없습니다."),

    // Cafe Resources (Rxxx)
    CAFE_NOT_FOUND(HttpStatus.NOT_FOUND, ErrorType.NOT_FOUND, "R001", "카페를 찾을 수 없습니다."),
    CAFE_INACTIVE(HttpStatus.BAD_REQUEST, ErrorType.INACTIVE_RESOURCE, "R002", "비활성화된 카페입니다."),
    TABLE_NOT_FOUND(HttpStatus.NOT_FOUND, ErrorType.NOT_FOUND, "R003", "테이블을 찾을 수 없습니다."),
    TABLE_INACTIVE(HttpStatus.BAD_REQUEST, ErrorType.INACTIVE_RESOURCE, "R004", "비활성화된 테이블입니다."),
    SLOT_NOT_FOUND(HttpStatus.NOT_FOUND, ErrorType.NOT_FOUND, "R005", "시간 슬롯을 찾을 수 없습니다."),
    SLOT_INACTIVE(HttpStatus.BAD_REQUEST, ErrorType.INACTIVE_RESOURCE, "R006", "비활성화된 시간 슬롯입니다."),
    INVALID_TIME_RANGE(HttpStatus.BAD_REQUEST, ErrorType.VALIDATION, "R007", "시작 시간은 종료 시간보다 빨라야 합니다."),

    // Booking Domain (Bxxx)
    BOOKING_NOT_FOUND(HttpStatus.NOT_FOUND, ErrorType.NOT_FOUND, "B001", "예약을 찾을 수 없습니다."),
    BOOKING_PAST_DATE(HttpStatus.BAD_REQUEST, ErrorType.TEMPORAL, "B002", "예약 날짜는 오늘 이후여야 합니다."),
    BOOKING_INACTIVE(HttpStatus.BAD_REQUEST, ErrorType.STATE, "B003", "비활성화된 예약은 변경할 수 없습니다."),
    TABLE_ALREADY_BOOKED(HttpStatus.CONFLICT, ErrorType.CONFLICT, "B004", "해당 시간에 이미 예약된 테이블입니다."),
    USER_ALREADY_BOOKED(HttpStatus.CONFLICT, ErrorType.CONFLICT, "B005", "같은 시간대에 이미 예약이 있습니다."),
    CONCURRENT_BOOKING(HttpStatus.CONFLICT, ErrorType.CONFLICT, "B006", "동시 예약 충돌이 발생했습니다."),
    NOT_ENOUGH_SEATS(HttpStatus.BAD_REQUEST, ErrorType.CAPACITY, "B007", "선택한 테이블의 좌석 수가 부족합니다."),
    INSUFFICIENT_PERMISSIONS(HttpStatus.FORBIDDEN, ErrorType.PERMISSION, "B008", "해당 예약에 대한 권한이 없습니다."),
    INVALID_STATUS_TRANSITION(HttpStatus.BAD_REQUEST, ErrorType.STATE, "B009", "허용되지 않는 예약 상태 변경입니다."),
    CANNOT_ACTIVATE_INACTIVE_STATUS(HttpStatus.BAD_REQUEST, ErrorType.STATE, "B010", "취소 또는 완료된 예약은 활성화할 수 없습니다."),
    CANNOT_DEACTIVATE_ACTIVE_STATUS(HttpStatus.BAD_REQUEST, ErrorType.STATE, "B011", "대기 또는 확정된 예약은 비활성화할 수 없습니다.");

    private final HttpStatus httpStatus;
    private final ErrorType type;
    private final String code;
    private final String message;

    ErrorCode(HttpStatus httpStatus, ErrorType type, String code, String message) {
        this.httpStatus = httpStatus;
        this.type = type;
        this.code = code;
        this.message = message;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public ErrorType getType() {
        return type;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
