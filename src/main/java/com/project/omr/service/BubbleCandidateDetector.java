package com.project.omr.service;

import com.project.omr.DTOs.BinaryMask;
import com.project.omr.DTOs.BubbleCandidate;
import com.project.omr.config.OmrProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.awt.Point;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

/**
 * Finds bubble-shaped dark components on a mask.
 *
 * <p>Components are 8-connected. A component is kept when its bounding-box
 * area and width/height ratio fall inside the configured inclusive ranges.
 * Its region is the component, the holes it encloses and the ellipse
 * inscribed in its bounding box, so an outline with a break still covers the
 * whole disc. A separate mark lying in that region belongs to the bubble.</p>
 */
@Component
public class BubbleCandidateDetector {
    private static final Logger log = LoggerFactory.getLogger(BubbleCandidateDetector.class);

    private static final int[][] NEIGHBOURS_8 = {
            {-1, -1}, {0, -1}, {1, -1},
            {-1, 0}, {1, 0},
            {-1, 1}, {0, 1}, {1, 1}
    };
    private static final int[][] NEIGHBOURS_4 = {{0, -1}, {0, 1}, {-1, 0}, {1, 0}};

    public List<BubbleCandidate> findCandidates(BinaryMask mask,
                                                OmrProperties.AreaRange areaRange,
                                                OmrProperties.RatioRange aspectRatioRange) {
        final int w = mask.width(), h = mask.height();
        boolean[] dark = mask.dark();
        int[] labels = new int[w * h];
        boolean[] enclosed = new boolean[w * h];
        ArrayDeque<Point> q = new ArrayDeque<>();
        List<BubbleCandidate> candidates = new ArrayList<>();

        int nextLabel = 1;
        int rejected = 0;
        int nested = 0;

        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int idx = y * w + x;
                if (!dark[idx] || labels[idx] != 0) continue;

                int label = nextLabel++;
                int[] box = floodFill(dark, labels, q, x, y, w, h, label);
                int bw = box[2] - box[0] + 1;
                int bh = box[3] - box[1] + 1;

                if (enclosed[idx]) {
                    nested++;
                    continue;
                }
                if (!areaRange.contains(bw * bh) || !aspectRatioRange.contains(bw / (double) bh)) {
                    rejected++;
                    continue;
                }

                boolean[] region = bubbleRegion(labels, label, box[0], box[1], bw, bh, w);
                int regionPixels = 0;
                for (int ly = 0; ly < bh; ly++) {
                    for (int lx = 0; lx < bw; lx++) {
                        if (!region[ly * bw + lx]) continue;
                        regionPixels++;
                        int gIdx = (box[1] + ly) * w + (box[0] + lx);
                        if (labels[gIdx] != label) {
                            enclosed[gIdx] = true;
                        }
                    }
                }
                candidates.add(new BubbleCandidate(box[0], box[1], bw, bh, region, regionPixels));
            }
        }

        log.debug("Components: {}, bubble candidates: {}, rejected by shape: {}, nested: {}",
                nextLabel - 1, candidates.size(), rejected, nested);
        return candidates;
    }

    /** Labels one component and returns its bounding box as {minX, minY, maxX, maxY}. */
    private int[] floodFill(boolean[] fg, int[] labels, ArrayDeque<Point> q,
                            int startX, int startY, int w, int h, int label) {
        q.clear();
        q.add(new Point(startX, startY));
        labels[startY * w + startX] = label;
        int minX = startX, maxX = startX, minY = startY, maxY = startY;

        while (!q.isEmpty()) {
            Point p = q.removeFirst();
            minX = Math.min(minX, p.x);
            maxX = Math.max(maxX, p.x);
            minY = Math.min(minY, p.y);
            maxY = Math.max(maxY, p.y);

            for (int[] dir : NEIGHBOURS_8) {
                int nx = p.x + dir[0];
                int ny = p.y + dir[1];
                if (nx >= 0 && nx < w && ny >= 0 && ny < h) {
                    int nIdx = ny * w + nx;
                    if (fg[nIdx] && labels[nIdx] == 0) {
                        labels[nIdx] = label;
                        q.add(new Point(nx, ny));
                    }
                }
            }
        }
        return new int[]{minX, minY, maxX, maxY};
    }

    /**
     * Component pixels, every box pixel that cannot reach the box border
     * without crossing the component, and the inscribed ellipse.
     */
    private static boolean[] bubbleRegion(int[] labels, int label, int bx, int by, int bw, int bh, int imageWidth) {
        int n = bw * bh;
        boolean[] component = new boolean[n];
        for (int ly = 0; ly < bh; ly++) {
            for (int lx = 0; lx < bw; lx++) {
                component[ly * bw + lx] = labels[(by + ly) * imageWidth + (bx + lx)] == label;
            }
        }

        boolean[] outside = new boolean[n];
        ArrayDeque<Point> q = new ArrayDeque<>();
        for (int lx = 0; lx < bw; lx++) {
            seedOutside(component, outside, q, lx, 0, bw);
            seedOutside(component, outside, q, lx, bh - 1, bw);
        }
        for (int ly = 1; ly < bh - 1; ly++) {
            seedOutside(component, outside, q, 0, ly, bw);
            seedOutside(component, outside, q, bw - 1, ly, bw);
        }

        while (!q.isEmpty()) {
            Point p = q.removeFirst();
            for (int[] dir : NEIGHBOURS_4) {
                int nx = p.x + dir[0];
                int ny = p.y + dir[1];
                if (nx >= 0 && nx < bw && ny >= 0 && ny < bh) {
                    int nIdx = ny * bw + nx;
                    if (!component[nIdx] && !outside[nIdx]) {
                        outside[nIdx] = true;
                        q.add(new Point(nx, ny));
                    }
                }
            }
        }

        double cx = (bw - 1) / 2.0, cy = (bh - 1) / 2.0;
        double rx = bw / 2.0, ry = bh / 2.0;
        boolean[] region = new boolean[n];
        for (int ly = 0; ly < bh; ly++) {
            for (int lx = 0; lx < bw; lx++) {
                double dx = (lx - cx) / rx, dy = (ly - cy) / ry;
                int i = ly * bw + lx;
                region[i] = !outside[i] || dx * dx + dy * dy <= 1.0;
            }
        }
        return region;
    }

    private static void seedOutside(boolean[] component, boolean[] outside, ArrayDeque<Point> q, int x, int y, int bw) {
        int idx = y * bw + x;
        if (!component[idx] && !outside[idx]) {
            outside[idx] = true;
            q.add(new Point(x, y));
        }
    }
}
