package com.project.omr.service;

import com.project.omr.DTOs.BinaryMask;
import com.project.omr.DTOs.BubbleCandidate;
import com.project.omr.DTOs.FillScore;
import com.project.omr.DTOs.MarkStatus;
import com.project.omr.DTOs.QuestionResult;
import com.project.omr.DTOs.Row;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FillClassifierTest {
    private final FillClassifier classifier = new FillClassifier();

    private static final int W = 200, H = 40;

    /** Four 20x20 bubbles at x = 10, 50, 90, 130; {@code darkRows[i]} top rows of bubble i are inked. */
    private static Fixture fixture(int... darkRows) {
        boolean[] dark = new boolean[W * H];
        List<BubbleCandidate> bubbles = new ArrayList<>();
        for (int i = 0; i < darkRows.length; i++) {
            int x0 = 10 + i * 40;
            boolean[] region = new boolean[400];
            Arrays.fill(region, true);
            bubbles.add(new BubbleCandidate(x0, 10, 20, 20, region, 400));
            for (int y = 10; y < 10 + darkRows[i]; y++) {
                for (int x = x0; x < x0 + 20; x++) {
                    dark[y * W + x] = true;
                }
            }
        }
        return new Fixture(new BinaryMask(W, H, dark), new Row(1, bubbles, 20.0));
    }

    private record Fixture(BinaryMask mask, Row row) {}

    @Test
    void classify_singleFilledBubble_returnsItsLetter() {
        Fixture f = fixture(2, 20, 3, 0);

        QuestionResult result = classifier.classify(f.row(), f.mask(), 40.0);

        assertThat(result.status()).isEqualTo(MarkStatus.MARKED);
        assertThat(result.answer()).isEqualTo("B");
        assertThat(result.fillRatios()).containsEntry("A", 10.0).containsEntry("B", 100.0)
                .containsEntry("C", 15.0).containsEntry("D", 0.0);
    }

    @Test
    void classify_nothingAboveThreshold_isUnmarked() {
        Fixture f = fixture(2, 7, 3, 0);

        QuestionResult result = classifier.classify(f.row(), f.mask(), 40.0);

        assertThat(result.status()).isEqualTo(MarkStatus.UNMARKED);
        assertThat(result.answer()).isEqualTo("unmarked");
        assertThat(result.option()).isNull();
    }

    @Test
    void classify_twoAboveThreshold_isAmbiguousAndKeepsAllRatios() {
        Fixture f = fixture(20, 2, 19, 0);

        QuestionResult result = classifier.classify(f.row(), f.mask(), 40.0);

        assertThat(result.status()).isEqualTo(MarkStatus.AMBIGUOUS);
        assertThat(result.answer()).isEqualTo("ambiguous");
        assertThat(result.fillRatios()).containsOnlyKeys("A", "B", "C", "D");
    }

    @Test
    void classify_ratioEqualToThreshold_countsAsFilled() {
        Fixture f = fixture(8, 0, 0, 0); // exactly 40 %

        assertThat(classifier.classify(f.row(), f.mask(), 40.0).answer()).isEqualTo("A");
    }

    @Test
    void score_ratiosAreAlwaysPercentages() {
        Fixture f = fixture(0, 5, 13, 20);

        List<FillScore> scores = classifier.score(f.row(), f.mask());

        assertThat(scores).extracting(FillScore::option).containsExactly("A", "B", "C", "D");
        assertThat(scores).allSatisfy(s -> assertThat(s.fillRatio()).isBetween(0.0, 100.0));
    }
}
