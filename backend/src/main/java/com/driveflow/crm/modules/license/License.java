package com.driveflow.crm.modules.license;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "licenses")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class License {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** Category code, e.g. "B" or "A2". */
    @Column(nullable = false, unique = true, length = 5)
    private String type;
}
