package com.project.omr.service;

import com.project.omr.DTOs.BinaryMask;
import com.project.omr.DTOs.BubbleCandidate;
import com.project.omr.DTOs.FillScore;
import com.project.omr.DTOs.MarkStatus;
import com.project.omr.DTOs.QuestionResult;
import com.project.omr.DTOs.Row;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class FillClassifier {

    public QuestionResult classify(Row row, BinaryMask mask, double fillThreshold) {
        List<FillScore> scores = score(row, mask);

        Map<String, Double> fills = new LinkedHashMap<>();
        List<String> filled = new ArrayList<>();
        for (FillScore score : scores) {
            fills.put(score.option(), score.fillRatio());
            if (score.fillRatio() >= fillThreshold) {
                filled.add(score.option());
            }
        }

        // no highest-ratio tie-break: two filled bubbles are ambiguous
        if (filled.size() == 1) {
            return new QuestionResult(row.questionNumber(), MarkStatus.MARKED, filled.get(0), fills);
        }
        MarkStatus status = filled.isEmpty() ? MarkStatus.UNMARKED : MarkStatus.AMBIGUOUS;
        return new QuestionResult(row.questionNumber(), status, null, fills);
    }

    public List<FillScore> score(Row row, BinaryMask mask) {
        List<FillScore> scores = new ArrayList<>(row.bubbles().size());
        for (int i = 0; i < row.bubbles().size(); i++) {
            BubbleCandidate bubble = row.bubbles().get(i);
            scores.add(new FillScore(bubble, Row.optionLetter(i), fillRatio(bubble, mask)));
        }
        return scores;
    }

    /** Dark pixels inside the bubble region as a percentage of the region. */
    static double fillRatio(BubbleCandidate bubble, BinaryMask mask) {
        if (bubble.regionPixels() == 0) return 0.0;

        int darkPixels = 0;
        boolean[] region = bubble.region();
        for (int ly = 0; ly < bubble.height(); ly++) {
            int imageY = bubble.y() + ly;
            if (imageY < 0 || imageY >= mask.height()) continue;
            for (int lx = 0; lx < bubble.width(); lx++) {
                int imageX = bubble.x() + lx;
                if (imageX < 0 || imageX >= mask.width()) continue;
                if (region[ly * bubble.width() + lx] && mask.isDark(imageX, imageY)) {
                    darkPixels++;
                }
            }
        }
        double ratio = 100.0 * darkPixels / bubble.regionPixels();
        return Math.max(0.0, Math.min(100.0, ratio));
    }
}
