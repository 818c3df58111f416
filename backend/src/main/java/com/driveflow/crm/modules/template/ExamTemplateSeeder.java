package com.driveflow.crm.modules.template;

import com.driveflow.crm.modules.license.License;
import com.driveflow.crm.modules.license.LicenseRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Startup bootstrap for exam templates. Enabled per deployment with
 * {@code driveflow.seed.enabled=true}.
 *
 * Rules:
 * 1. A template is only created for a license that already exists.
 * 2. An existing template is never touched, so repeated runs are no-ops.
 * 3. Item order follows declaration order, numbered from 1.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "driveflow.seed", name = "enabled", havingValue = "true")
public class ExamTemplateSeeder implements ApplicationRunner {

    private final TemplateSeedProperties properties;
    private final LicenseRepository licenseRepository;
    private final ExamTemplateRepository templateRepository;

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        int created = seed();
        log.info("Exam template seeding finished: {} created, {} defined", created,
                properties.getTemplates().size());
    }

    /** @return number of templates created by this run */
    @Transactional
    public int seed() {
        int created = 0;
        for (TemplateSeedProperties.TemplateDefinition definition : properties.getTemplates()) {
            requireUniqueDescriptions(definition);

            Optional<License> license = licenseRepository.findByType(definition.getLicenseType());
            if (license.isEmpty()) {
                log.warn("Skipping exam template seed: license type '{}' does not exist",
                        definition.getLicenseType());
                continue;
            }
            if (templateRepository.existsByLicenseId(license.get().getId())) {
                log.debug("Exam template for license '{}' already present", definition.getLicenseType());
                continue;
            }

            ExamTemplate template = ExamTemplate.builder()
                    .license(license.get())
                    .maxPoints(definition.getMaxPoints())
                    .build();
            List<TemplateSeedProperties.ItemDefinition> items = definition.getItems();
            for (int i = 0; i < items.size(); i++) {
                template.getItems().add(TemplateItem.builder()
                        .template(template)
                        .description(items.get(i).getDescription().trim())
                        .penaltyPoints(items.get(i).getPenaltyPoints())
                        .orderIndex(i + 1)
                        .build());
            }
            templateRepository.save(template);
            created++;
            log.info("Seeded exam template for license '{}' with {} items (max {} points)",
                    definition.getLicenseType(), items.size(), definition.getMaxPoints());
        }
        return created;
    }

    private void requireUniqueDescriptions(TemplateSeedProperties.TemplateDefinition definition) {
        Set<String> seen = new HashSet<>();
        for (TemplateSeedProperties.ItemDefinition item : definition.getItems()) {
            if (!seen.add(item.getDescription().trim())) {
                throw new IllegalStateException("Duplicate item description '" + item.getDescription()
                        + "' in exam template seed for license '" + definition.getLicenseType() + "'");
            }
        }
    }
}
