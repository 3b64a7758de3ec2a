package personal.cafe.core.user.domain.model;

/**
 * User Role
 * 사용자 플래그로부터 파생되는 역할
 */
public enum UserRole {
    CUSTOMER,
    MANAGER,
    ADMIN;

    /**
     * superuser 플래그가 manager 플래그보다 우선
     */
    public static UserRole of(boolean superuser, boolean manager) {
        if (superuser) {
            return ADMIN;
        }
        return manager ? MANAGER : CUSTOMER;
    }

    public boolean isStaff() {
        return this != CUSTOMER;
    }
}
