package personal.cafe.core.booking.domain.model;

import personal.cafe.core.user.domain.model.UserRole;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Status Transition Matrix
 * 역할별, 현재 상태별로 허용되는 다음 상태 목록
 */
public final class StatusTransitionMatrix {

    private final Map<UserRole, Map<BookingStatus, Set<BookingStatus>>> transitions;

    private StatusTransitionMatrix(Map<UserRole, Map<BookingStatus, Set<BookingStatus>>> transitions) {
        Map<UserRole, Map<BookingStatus, Set<BookingStatus>>> copy = new EnumMap<>(UserRole.class);
        transitions.forEach((role, byStatus) -> {
            Map<BookingStatus, Set<BookingStatus>> statusCopy = new EnumMap<>(BookingStatus.class);
            byStatus.forEach((from, targets) -> statusCopy.put(from, Set.copyOf(targets)));
            copy.put(role, Map.copyOf(statusCopy));
        });
        this.transitions = Map.copyOf(copy);
    }

    public static StatusTransitionMatrix of(Map<UserRole, Map<BookingStatus, Set<BookingStatus>>> transitions) {
        return new StatusTransitionMatrix(transitions);
    }

    /**
     * 기본 정책
     * CUSTOMER: PENDING -> CANCELLED
     * MANAGER: PENDING -> CONFIRMED/CANCELLED, CONFIRMED -> CANCELLED/COMPLETED
     * ADMIN: 종료 상태를 포함한 모든 상태 간 전이
     */
    public static StatusTransitionMatrix defaults() {
        Map<UserRole, Map<BookingStatus, Set<BookingStatus>>> transitions = new EnumMap<>(UserRole.class);

        transitions.put(UserRole.CUSTOMER, Map.of(
                BookingStatus.PENDING, EnumSet.of(BookingStatus.CANCELLED)));

        transitions.put(UserRole.MANAGER, Map.of(
                BookingStatus.PENDING, EnumSet.of(BookingStatus.CONFIRMED, BookingStatus.CANCELLED),
                BookingStatus.CONFIRMED, EnumSet.of(BookingStatus.CANCELLED, BookingStatus.COMPLETED)));

        Map<BookingStatus, Set<BookingStatus>> any = new EnumMap<>(BookingStatus.class);
        Arrays.stream(BookingStatus.values()).forEach(from -> {
            Set<BookingStatus> targets = EnumSet.allOf(BookingStatus.class);
            targets.remove(from);
            any.put(from, targets);
        });
        transitions.put(UserRole.ADMIN, any);

        return new StatusTransitionMatrix(transitions);
    }

    public boolean allows(UserRole role, BookingStatus from, BookingStatus to) {
        return allowedTargets(role, from).contains(to);
    }

    public Set<BookingStatus> allowedTargets(UserRole role, BookingStatus from) {
        return transitions.getOrDefault(role, Map.of()).getOrDefault(from, Set.of());
    }
}
