package personal.cafe.core.booking.domain.exception;

import personal.cafe.common.exception.BusinessException;
import personal.cafe.common.exception.ErrorCode;

/**
 * Table Not Found Exception
 * 테이블이 없거나 다른 카페에 속한 경우 발생
 */
public class TableNotFoundException extends BusinessException {
    public TableNotFoundException(Long tableId, Long cafeId) {
        super(ErrorCode.TABLE_NOT_FOUND,
                String.format("Table not found in cafe: tableId=%d, cafeId=%d", tableId, cafeId));
    }
}
