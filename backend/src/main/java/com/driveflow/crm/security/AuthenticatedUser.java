package com.driveflow.crm.security;

import lombok.Getter;

/**
 * Identity carried by an access token. {@code schoolId} is null for users not
 * attached to a driving school.
 */
@Getter
public class AuthenticatedUser {
    private final String id;
    private final String email;
    private final String role;
    private final Long schoolId;

    public AuthenticatedUser(String id, String email, String role, Long schoolId) {
        this.id = id;
        this.email = email;
        this.role = role;
        this.schoolId = schoolId;
    }
}
