package com.driveflow.crm.modules.template;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class ExamTemplateDto {
    private Long id;
    private Long licenseId;
    private Integer maxPoints;
    private List<ItemDto> items;

    @Data
    @Builder
    public static class ItemDto {
        private Long id;
        private String description;
        private Integer penaltyPoints;
        private Integer orderIndex;
    }
}
