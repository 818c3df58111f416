package com.driveflow.crm.modules.enrollment;

import com.driveflow.crm.modules.license.License;
import com.driveflow.crm.modules.user.User;
import jakarta.persistence.*;
import lombok.*;

/**
 * A student's registration in a teaching category at a driving school. The
 * instructor and license may still be unassigned while the enrollment is a draft.
 */
@Entity
@Table(name = "enrollments")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Enrollment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "student_id", nullable = false)
    private User student;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "instructor_id")
    private User instructor;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "license_id")
    private License license;

    @Column(name = "auto_school_id", nullable = false)
    private Long autoSchoolId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private EnrollmentStatus status = EnrollmentStatus.DRAFT;

    public enum EnrollmentStatus {
        DRAFT, APPROVED, REJECTED
    }
}
