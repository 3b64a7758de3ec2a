package personal.cafe.core.booking.domain.exception;

import personal.cafe.common.exception.BusinessException;
import personal.cafe.common.exception.ErrorCode;

/**
 * Table Inactive Exception
 * 비활성화된 테이블을 예약하려 할 때 발생
 */
public class TableInactiveException extends BusinessException {
    public TableInactiveException(Long tableId) {
        super(ErrorCode.TABLE_INACTIVE,
                String.format("Table is inactive: tableId=%d", tableId));
    }
}
