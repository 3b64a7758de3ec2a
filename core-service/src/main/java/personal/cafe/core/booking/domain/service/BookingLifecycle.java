package personal.cafe.core.booking.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.cafe.core.booking.domain.exception.CannotActivateInactiveStatusException;
import personal.cafe.core.booking.domain.exception.CannotDeactivateActiveStatusException;
import personal.cafe.core.booking.domain.exception.InsufficientPermissionsException;
import personal.cafe.core.booking.domain.exception.InvalidStatusTransitionException;
import personal.cafe.core.booking.domain.model.Booking;
import personal.cafe.core.booking.domain.model.BookingStatus;
import personal.cafe.core.booking.domain.model.StatusTransitionMatrix;
import personal.cafe.core.user.domain.model.Actor;
import personal.cafe.core.user.domain.model.UserRole;

/**
 * Booking Lifecycle (Domain Service)
 * 역할별 상태 전이와 활성 여부 일관성 검증
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingLifecycle {

    private final StatusTransitionMatrix transitionMatrix;

    /**
     * 고객은 본인 예약만, 매니저/관리자는 모든 예약에 접근 가능
     */
    public void checkPermission(Booking booking, Actor actor) {
        if (actor.isCustomer() && !booking.isOwnedBy(actor.userId())) {
            log.debug("Permission denied: bookingId={}, userId={}", booking.id(), actor.userId());
            throw new InsufficientPermissionsException(booking.id(), actor.userId());
        }
    }

    public BookingStatus applyTransition(BookingStatus current, BookingStatus requested, UserRole role) {
        if (!transitionMatrix.allows(role, current, requested)) {
            throw new InvalidStatusTransitionException(current, requested, role);
        }
        if (current.isTerminal()) {
            log.info("Status override out of terminal state: from={}, to={}, role={}", current, requested, role);
        }
        return requested;
    }

    /**
     * 활성 여부는 최종 상태로부터 결정됨
     * 명시적으로 전달된 값이 최종 상태와 맞지 않으면 덮어쓰지 않고 거절
     *
     * @param resultingStatus 상태 변경이 반영된 최종 상태
     * @param requestedActive 요청된 활성 여부 (없으면 null)
     */
    public boolean resolveActive(BookingStatus resultingStatus, Boolean requestedActive) {
        boolean derived = resultingStatus.isActive();
        if (requestedActive == null || requestedActive == derived) {
            return derived;
        }
        if (requestedActive) {
            throw new CannotActivateInactiveStatusException(resultingStatus);
        }
        throw new CannotDeactivateActiveStatusException(resultingStatus);
    }
}
