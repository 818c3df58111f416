package com.driveflow.crm.modules.evaluation;

/** How many times one template item was observed during a lesson. */
public record MistakeEntry(long itemId, int count) {
}
