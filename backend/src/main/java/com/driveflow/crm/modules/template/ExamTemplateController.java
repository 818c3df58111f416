package com.driveflow.crm.modules.template;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/licenses")
@RequiredArgsConstructor
@Tag(name = "Exam templates", description = "Official mistake sheets per license category")
public class ExamTemplateController {

    private final ExamTemplateService templateService;

    @GetMapping("/{licenseId}/exam-template")
    @Operation(summary = "Get the exam template and its ordered items for a license")
    public ResponseEntity<ExamTemplateDto> getTemplate(@PathVariable Long licenseId) {
        return ResponseEntity.ok(templateService.getTemplateByLicense(licenseId));
    }
}
