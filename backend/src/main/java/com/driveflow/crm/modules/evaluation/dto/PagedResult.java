package com.driveflow.crm.modules.evaluation.dto;

import java.util.List;

/** Page envelope with a 1-based page number and the unpaged total. */
public record PagedResult<T>(int page, int pageSize, long total, List<T> items) {
}
