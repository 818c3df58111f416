package com.driveflow.crm.modules.evaluation;

import com.driveflow.crm.exception.BusinessException;
import com.driveflow.crm.modules.template.ExamTemplate;
import com.driveflow.crm.modules.template.TemplateItem;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Validates a reported mistake list against a template and computes the
 * authoritative score. Stateless; all-or-nothing: one bad entry rejects the list.
 */
@Component
public class EvaluationScorer {

    public ScoredSheet score(ExamTemplate template, List<MistakeEntry> reported) {
        Map<Long, TemplateItem> itemsById = new HashMap<>();
        for (TemplateItem item : template.getItems()) {
            itemsById.put(item.getId(), item);
        }

        Map<Long, MistakeEntry> accepted = new HashMap<>();
        for (MistakeEntry entry : reported) {
            if (entry.count() < 0) {
                throw new BusinessException("Mistake count must not be negative (item " + entry.itemId() + ")");
            }
            if (!itemsById.containsKey(entry.itemId())) {
                throw new BusinessException("Item " + entry.itemId()
                        + " does not belong to the exam template for this lesson");
            }
            if (accepted.put(entry.itemId(), entry) != null) {
                throw new BusinessException("Item " + entry.itemId() + " is listed more than once");
            }
        }

        List<MistakeEntry> mistakes = new ArrayList<>();
        int total = 0;
        try {
            for (MistakeEntry entry : accepted.values()) {
                if (entry.count() == 0) {
                    continue;
                }
                TemplateItem item = itemsById.get(entry.itemId());
                total = Math.addExact(total, Math.multiplyExact(entry.count(), item.getPenaltyPoints()));
                mistakes.add(entry);
            }
        } catch (ArithmeticException e) {
            throw new BusinessException("Mistake counts are too large to score");
        }
        mistakes.sort(Comparator.comparing(m -> itemsById.get(m.itemId()).getOrderIndex()));

        int maxPoints = template.getMaxPoints();
        return new ScoredSheet(List.copyOf(mistakes), total, maxPoints, EvaluationResult.of(total, maxPoints));
    }

    public record ScoredSheet(List<MistakeEntry> mistakes, int totalPoints, int maxPoints,
            EvaluationResult result) {
    }
}
