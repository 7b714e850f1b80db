package com.project.omr.service;

import com.project.omr.DTOs.BubbleCandidate;
import com.project.omr.DTOs.Row;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class RowClustererTest {
    private final RowClusterer clusterer = new RowClusterer();

    /** 20x20 candidate centred on (cx, cy). */
    private static BubbleCandidate at(int cx, int cy) {
        boolean[] region = new boolean[400];
        java.util.Arrays.fill(region, true);
        return new BubbleCandidate(cx - 10, cy - 10, 20, 20, region, 400);
    }

    private static List<BubbleCandidate> grid(int rows, int options) {
        List<BubbleCandidate> all = new ArrayList<>();
        for (int r = 0; r < rows; r++) {
            for (int o = 0; o < options; o++) {
                all.add(at(50 + o * 40, 50 + r * 40 + (o % 2) * 3)); // slight skew
            }
        }
        return all;
    }

    @Test
    void clusterRows_shuffledGrid_ordersRowsTopDownAndBubblesLeftRight() {
        List<BubbleCandidate> candidates = grid(5, 4);
        Collections.shuffle(candidates, new Random(7));

        List<Row> rows = clusterer.clusterRows(candidates, 15.0, 4);

        assertThat(rows).hasSize(5);
        for (int i = 0; i < rows.size(); i++) {
            Row row = rows.get(i);
            assertThat(row.questionNumber()).isEqualTo(i + 1);
            assertThat(row.bubbles()).extracting(BubbleCandidate::centerX)
                    .containsExactly(50.0, 90.0, 130.0, 170.0);
            assertThat(row.meanY()).isBetween(50.0 + i * 40, 53.0 + i * 40);
        }
    }

    @Test
    void clusterRows_rowWithExtraBubble_isDropped() {
        List<BubbleCandidate> candidates = grid(3, 4);
        candidates.add(at(210, 90)); // fifth bubble in the second row

        List<Row> rows = clusterer.clusterRows(candidates, 15.0, 4);

        assertThat(rows).extracting(Row::questionNumber).containsExactly(1, 2);
        assertThat(rows.get(1).meanY()).isBetween(130.0, 133.0);
    }

    @Test
    void clusterRows_membersWithinRowThreshold_stayTogether() {
        List<BubbleCandidate> candidates = List.of(at(10, 100), at(50, 110), at(90, 105));

        assertThat(clusterer.clusterRows(candidates, 10.0, 3)).hasSize(1);
        assertThat(clusterer.clusterRows(candidates, 4.0, 3)).isEmpty();
    }

    @Test
    void clusterRows_noCandidates_givesNoRows() {
        assertThat(clusterer.clusterRows(List.of(), 15.0, 4)).isEmpty();
    }

    @Test
    void optionLetter_mapsIndexToLetter() {
        assertThat(Row.optionLetter(0)).isEqualTo("A");
        assertThat(Row.optionLetter(3)).isEqualTo("D");
    }
}
