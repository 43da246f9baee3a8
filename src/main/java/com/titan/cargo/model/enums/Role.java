package com.titan.cargo.model.enums;

import lombok.Getter;

@Getter
public enum Role implements CodedEnum {
    ADMIN("admin"),
    USER("user"),
    DRIVER("driver"),
    PILOT("pilot");

    private final String value;

    Role(String value) {
        this.value = value;
    }

    public String getAuthority() {
        return "ROLE_" + name();
    }

    /**
     * Unknown or missing roles fall back to {@link #USER}.
     */
    public static Role fromValueOrDefault(String raw) {
        if (raw != null) {
            for (Role role : values()) {
                if (role.value.equals(raw)) {
                    return role;
                }
            }
        }
        return USER;
    }
}
