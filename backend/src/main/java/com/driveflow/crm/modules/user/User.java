package com.driveflow.crm.modules.user;

import jakarta.persistence.*;
import lombok.*;

import java.util.UUID;

/**
 * Account row owned by the account service. Read here for display names, roles
 * and school membership only.
 */
@Entity
@Table(name = "users")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class User {

    @Id
    private UUID id;

    @Column(name = "first_name", nullable = false, length = 100)
    private String firstName;

    @Column(name = "last_name", nullable = false, length = 100)
    private String lastName;

    @Column(nullable = false, unique = true, length = 150)
    private String email;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Role role;

    @Column(name = "auto_school_id")
    private Long autoSchoolId;

    public String getDisplayName() {
        return (firstName + " " + lastName).trim();
    }

    public enum Role {
        STUDENT, INSTRUCTOR, SCHOOL_ADMIN, SUPER_ADMIN
    }
}
