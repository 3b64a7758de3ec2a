package personal.cafe.core.booking.domain.model;

import personal.cafe.common.exception.BusinessException;
import personal.cafe.common.exception.ErrorCode;

import java.time.LocalTime;

/**
 * Time Interval (Value Object)
 * 하루 중 반개구간 [start, end)
 */
public record TimeInterval(
        LocalTime start,
        LocalTime end
) {
    public TimeInterval {
        if (start == null || end == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Interval bounds cannot be null");
        }
        if (!start.isBefore(end)) {
            throw new BusinessException(ErrorCode.INVALID_TIME_RANGE,
                    String.format("Interval start must be before end: start=%s, end=%s", start, end));
        }
    }

    public static TimeInterval of(LocalTime start, LocalTime end) {
        return new TimeInterval(start, end);
    }

    /**
     * 두 반개구간의 교차 여부
     * 끝점이 맞닿는 경우(aEnd == bStart)는 겹치지 않음
     */
    public static boolean overlaps(LocalTime aStart, LocalTime aEnd, LocalTime bStart, LocalTime bEnd) {
        return aStart.isBefore(bEnd) && bStart.isBefore(aEnd);
    }

    public boolean overlaps(TimeInterval other) {
        return overlaps(start, end, other.start, other.end);
    }
}
