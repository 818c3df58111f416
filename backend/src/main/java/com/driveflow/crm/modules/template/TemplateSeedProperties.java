package com.driveflow.crm.modules.template;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Template definitions applied by {@link ExamTemplateSeeder}. Bound from
 * {@code driveflow.seed.*}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "driveflow.seed")
public class TemplateSeedProperties {

    private boolean enabled = false;

    @Valid
    private List<TemplateDefinition> templates = new ArrayList<>();

    @Data
    public static class TemplateDefinition {
        @NotBlank
        private String licenseType;

        @NotNull
        @Min(0)
        private Integer maxPoints;

        @Valid
        private List<ItemDefinition> items = new ArrayList<>();
    }

    @Data
    public static class ItemDefinition {
        @NotBlank
        private String description;

        @NotNull
        @Min(0)
        private Integer penaltyPoints;
    }
}
