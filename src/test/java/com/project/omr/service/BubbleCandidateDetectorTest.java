package com.project.omr.service;

import com.project.omr.DTOs.BinaryMask;
import com.project.omr.DTOs.BubbleCandidate;
import com.project.omr.config.OmrProperties.AreaRange;
import com.project.omr.config.OmrProperties.RatioRange;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BubbleCandidateDetectorTest {
    private final BubbleCandidateDetector detector = new BubbleCandidateDetector();
    private static final RatioRange SQUARE_ISH = new RatioRange(0.7, 1.3);

    private static void fill(boolean[] dark, int w, int x0, int y0, int bw, int bh) {
        for (int y = y0; y < y0 + bh; y++) {
            for (int x = x0; x < x0 + bw; x++) {
                dark[y * w + x] = true;
            }
        }
    }

    private static void ring(boolean[] dark, int w, int x0, int y0, int size, int thickness) {
        fill(dark, w, x0, y0, size, thickness);
        fill(dark, w, x0, y0 + size - thickness, size, thickness);
        fill(dark, w, x0, y0, thickness, size);
        fill(dark, w, x0 + size - thickness, y0, thickness, size);
    }

    @Test
    void findCandidates_areaExactlyOnBounds_isKept() {
        int w = 100, h = 100;
        boolean[] dark = new boolean[w * h];
        fill(dark, w, 10, 10, 15, 15); // 225 px box
        BinaryMask mask = new BinaryMask(w, h, dark);

        assertThat(detector.findCandidates(mask, new AreaRange(225, 500), SQUARE_ISH)).hasSize(1);
        assertThat(detector.findCandidates(mask, new AreaRange(100, 225), SQUARE_ISH)).hasSize(1);
        assertThat(detector.findCandidates(mask, new AreaRange(226, 500), SQUARE_ISH)).isEmpty();
        assertThat(detector.findCandidates(mask, new AreaRange(100, 224), SQUARE_ISH)).isEmpty();
    }

    @Test
    void findCandidates_aspectRatioBoundIsInclusive() {
        int w = 100, h = 100;
        boolean[] dark = new boolean[w * h];
        fill(dark, w, 20, 20, 20, 16); // ratio 1.25
        BinaryMask mask = new BinaryMask(w, h, dark);

        assertThat(detector.findCandidates(mask, new AreaRange(1, 10_000), new RatioRange(0.8, 1.25))).hasSize(1);
        assertThat(detector.findCandidates(mask, new AreaRange(1, 10_000), new RatioRange(0.8, 1.2))).isEmpty();
    }

    @Test
    void findCandidates_rejectsLinesAndSpecks() {
        int w = 200, h = 100;
        boolean[] dark = new boolean[w * h];
        fill(dark, w, 10, 10, 150, 3);  // ruled line
        fill(dark, w, 10, 60, 4, 4);    // speck
        ring(dark, w, 100, 40, 30, 3);  // bubble
        BinaryMask mask = new BinaryMask(w, h, dark);

        List<BubbleCandidate> found = detector.findCandidates(mask, new AreaRange(200, 8000), SQUARE_ISH);

        assertThat(found).hasSize(1);
        BubbleCandidate bubble = found.get(0);
        assertThat(bubble.x()).isEqualTo(100);
        assertThat(bubble.y()).isEqualTo(40);
        assertThat(bubble.boundingArea()).isEqualTo(900);
        assertThat(bubble.aspectRatio()).isEqualTo(1.0);
        assertThat(bubble.centerX()).isEqualTo(115.0);
        assertThat(bubble.centerY()).isEqualTo(55.0);
    }

    @Test
    void findCandidates_regionIncludesEnclosedHole() {
        int w = 60, h = 60;
        boolean[] dark = new boolean[w * h];
        ring(dark, w, 10, 10, 30, 3);
        BinaryMask mask = new BinaryMask(w, h, dark);

        BubbleCandidate bubble = detector.findCandidates(mask, new AreaRange(200, 8000), SQUARE_ISH).get(0);

        assertThat(bubble.regionPixels()).isEqualTo(900);
        assertThat(bubble.inRegion(25, 25)).isTrue();
        assertThat(bubble.inRegion(5, 5)).isFalse();
    }

    @Test
    void findCandidates_ringWithGap_stillCoversTheDisc() {
        int w = 60, h = 60;
        boolean[] dark = new boolean[w * h];
        ring(dark, w, 10, 10, 40, 2);
        for (int x = 29; x <= 31; x++) {
            dark[10 * w + x] = false;
            dark[11 * w + x] = false;
        }
        BinaryMask mask = new BinaryMask(w, h, dark);

        BubbleCandidate bubble = detector.findCandidates(mask, new AreaRange(200, 8000), SQUARE_ISH).get(0);

        assertThat(bubble.width()).isEqualTo(40);
        assertThat(bubble.inRegion(30, 30)).isTrue();
        assertThat(bubble.regionPixels()).isGreaterThan(1200);
        assertThat(FillClassifier.fillRatio(bubble, mask)).isLessThan(40.0);
    }

    @Test
    void findCandidates_markInsideRing_belongsToTheRing() {
        int w = 80, h = 80;
        boolean[] dark = new boolean[w * h];
        ring(dark, w, 10, 10, 40, 2);
        fill(dark, w, 18, 18, 24, 24); // separate blob inside, bubble-sized on its own
        BinaryMask mask = new BinaryMask(w, h, dark);

        List<BubbleCandidate> found = detector.findCandidates(mask, new AreaRange(200, 8000), SQUARE_ISH);

        assertThat(found).hasSize(1);
        assertThat(found.get(0).width()).isEqualTo(40);
    }

    @Test
    void findCandidates_emptyMask_returnsNothing() {
        BinaryMask mask = new BinaryMask(50, 50, new boolean[2500]);

        assertThat(detector.findCandidates(mask, new AreaRange(200, 8000), SQUARE_ISH)).isEmpty();
    }
}
