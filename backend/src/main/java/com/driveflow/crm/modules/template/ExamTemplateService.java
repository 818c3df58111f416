package com.driveflow.crm.modules.template;

import com.driveflow.crm.exception.BusinessException;
import com.driveflow.crm.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Comparator;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class ExamTemplateService {

    private final ExamTemplateRepository templateRepository;

    @Transactional(readOnly = true)
    public ExamTemplateDto getTemplateByLicense(Long licenseId) {
        if (licenseId == null || licenseId <= 0) {
            throw new BusinessException("License ID must be positive");
        }
        return toDto(loadTemplateForLicense(licenseId));
    }

    /**
     * Loads the template with its items for the given license. Callers must be
     * inside a transaction if they navigate lazy associations afterwards.
     */
    @Transactional(readOnly = true)
    public ExamTemplate loadTemplateForLicense(Long licenseId) {
        return templateRepository.findWithItemsByLicenseId(licenseId)
                .orElseThrow(() -> new ResourceNotFoundException(
                        "No exam template found for license " + licenseId));
    }

    private ExamTemplateDto toDto(ExamTemplate template) {
        return ExamTemplateDto.builder()
                .id(template.getId())
                .licenseId(template.getLicense().getId())
                .maxPoints(template.getMaxPoints())
                .items(template.getItems().stream()
                        .sorted(Comparator.comparing(TemplateItem::getOrderIndex))
                        .map(i -> ExamTemplateDto.ItemDto.builder()
                                .id(i.getId())
                                .description(i.getDescription())
                                .penaltyPoints(i.getPenaltyPoints())
                                .orderIndex(i.getOrderIndex())
                                .build())
                        .collect(Collectors.toList()))
                .build();
    }
}
