package buildinghealth.security;

import java.util.Arrays;

public enum UserRole {
    ADMIN,
    ANALYST,
    OFFICER,
    TECHNICIAN,
    GUEST;

    /**
     * Puede reconocer y cerrar alertas.
     */
    public boolean canHandleAlerts() {
        return this == ADMIN || this == OFFICER;
    }

    public static String[] alertHandlers() {
        return Arrays.stream(values())
                .filter(UserRole::canHandleAlerts)
                .map(Enum::name)
                .toArray(String[]::new);
    }
}
