package com.driveflow.crm.modules.evaluation;

import com.driveflow.crm.modules.lesson.Lesson;
import com.driveflow.crm.modules.template.ExamTemplate;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * The scored mistake sheet of one lesson. Written once, already finalized, by
 * {@link EvaluationService#submit}; the unique constraint on {@code lesson_id}
 * is what guarantees a single sheet per lesson.
 */
@Entity
@Immutable
@Table(name = "evaluations", uniqueConstraints = @UniqueConstraint(
        name = Evaluation.LESSON_UNIQUE_CONSTRAINT, columnNames = "lesson_id"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Evaluation {

    public static final String LESSON_UNIQUE_CONSTRAINT = "uq_evaluations_lesson";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "lesson_id", nullable = false, updatable = false)
    private Lesson lesson;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "template_id", nullable = false, updatable = false)
    private ExamTemplate template;

    /** Non-zero counts only, in template display order. */
    @Convert(converter = MistakeListConverter.class)
    @Column(name = "mistakes_json", nullable = false, updatable = false, length = 4000)
    @Builder.Default
    private List<MistakeEntry> mistakes = new ArrayList<>();

    @Column(name = "total_points", updatable = false)
    private Integer totalPoints;

    @Enumerated(EnumType.STRING)
    @Column(length = 10, updatable = false)
    private EvaluationResult result;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "finalized_at", updatable = false)
    private Instant finalizedAt;
}
