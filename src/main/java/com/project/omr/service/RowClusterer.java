package com.project.omr.service;

import com.project.omr.DTOs.BubbleCandidate;
import com.project.omr.DTOs.Row;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Component
public class RowClusterer {
    private static final Logger log = LoggerFactory.getLogger(RowClusterer.class);

    private static final Comparator<BubbleCandidate> BY_Y =
            Comparator.comparingDouble(BubbleCandidate::centerY).thenComparingDouble(BubbleCandidate::centerX);
    private static final Comparator<BubbleCandidate> BY_X =
            Comparator.comparingDouble(BubbleCandidate::centerX).thenComparingDouble(BubbleCandidate::centerY);

    public List<Row> clusterRows(List<BubbleCandidate> candidates, double rowThreshold, int expectedOptions) {
        List<BubbleCandidate> sorted = new ArrayList<>(candidates);
        sorted.sort(BY_Y);

        List<List<BubbleCandidate>> groups = new ArrayList<>();
        List<Double> means = new ArrayList<>();
        List<BubbleCandidate> current = null;
        double meanY = 0.0;

        for (BubbleCandidate candidate : sorted) {
            double cy = candidate.centerY();
            if (current == null || Math.abs(cy - meanY) > rowThreshold) {
                if (current != null) {
                    groups.add(current);
                    means.add(meanY);
                }
                current = new ArrayList<>();
                current.add(candidate);
                meanY = cy;
            } else {
                current.add(candidate);
                meanY += (cy - meanY) / current.size();
            }
        }
        if (current != null) {
            groups.add(current);
            means.add(meanY);
        }

        List<Row> rows = new ArrayList<>();
        int dropped = 0;
        for (int i = 0; i < groups.size(); i++) {
            List<BubbleCandidate> members = groups.get(i);
            if (members.size() != expectedOptions) {
                dropped++;
                log.debug("Dropping row at y={} with {} bubbles (expected {})",
                        Math.round(means.get(i)), members.size(), expectedOptions);
                continue;
            }
            members.sort(BY_X);
            rows.add(new Row(rows.size() + 1, members, means.get(i)));
        }

        log.debug("Clustered {} candidates into {} rows ({} dropped)", candidates.size(), rows.size(), dropped);
        return rows;
    }
}
