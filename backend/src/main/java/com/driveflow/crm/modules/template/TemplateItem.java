package com.driveflow.crm.modules.template;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

@Entity
@Immutable
@Table(name = "template_items", uniqueConstraints = @UniqueConstraint(
        name = "uq_template_items_template_description", columnNames = { "template_id", "description" }))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TemplateItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "template_id", nullable = false)
    private ExamTemplate template;

    @Column(nullable = false, length = 500)
    private String description;

    @Column(name = "penalty_points", nullable = false)
    private Integer penaltyPoints;

    /** 1-based display position on the sheet. */
    @Column(name = "order_index", nullable = false)
    private Integer orderIndex;
}
