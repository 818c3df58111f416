package com.driveflow.crm.modules.template;

import com.driveflow.crm.modules.license.License;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Official mistake sheet for one license category. Seeded once and never updated;
 * evaluations point at it by id and are scored against it at submit time.
 */
@Entity
@Immutable
@Table(name = "exam_templates")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ExamTemplate {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @OneToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "license_id", nullable = false, unique = true)
    private License license;

    @Column(name = "max_points", nullable = false)
    private Integer maxPoints;

    @OneToMany(mappedBy = "template", cascade = CascadeType.PERSIST)
    @OrderBy("orderIndex ASC")
    @Builder.Default
    private List<TemplateItem> items = new ArrayList<>();

    public Optional<TemplateItem> findItem(Long itemId) {
        return items.stream().filter(i -> i.getId().equals(itemId)).findFirst();
    }
}
