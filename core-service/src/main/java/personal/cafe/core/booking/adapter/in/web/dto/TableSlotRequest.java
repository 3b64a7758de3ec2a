package personal.cafe.core.booking.adapter.in.web.dto;

import jakarta.validation.constraints.NotNull;
import personal.cafe.core.booking.domain.model.TableSlotAssignment;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 테이블 슬롯 요청 DTO
 */
public record TableSlotRequest(
        @NotNull(message = "테이블 ID는 필수입니다.")
        Long tableId,

        @NotNull(message = "슬롯 ID는 필수입니다.")
        Long slotId
) {
    public TableSlotAssignment toAssignment() {
        return TableSlotAssignment.of(tableId, slotId);
    }

    /**
     * 중복된 쌍은 하나로 합침
     */
    public static Set<TableSlotAssignment> toAssignments(Collection<TableSlotRequest> requests) {
        Set<TableSlotAssignment> assignments = new LinkedHashSet<>();
        requests.forEach(request -> assignments.add(request.toAssignment()));
        return assignments;
    }
}
