package com.project.omr.service;

import com.project.omr.DTOs.BinaryMask;
import com.project.omr.config.OmrProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.awt.Point;
import java.awt.image.BufferedImage;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

@Component
public class JavaPreprocessor implements Preprocessor {
    private static final Logger log = LoggerFactory.getLogger(JavaPreprocessor.class);

    @Override
    public OmrProperties.PreprocessorType type() {
        return OmrProperties.PreprocessorType.JAVA;
    }

    @Override
    public BinaryMask preprocess(BufferedImage input, OmrProperties settings) {
        Preprocessor.requireImage(input);

        final int w = input.getWidth(), h = input.getHeight();
        int[] gray = toGray(input);

        boolean[] dark;
        if (settings.thresholdMode() == OmrProperties.ThresholdMode.ADAPTIVE_MEAN) {
            dark = adaptiveMeanThreshold(gray, w, h, settings.adaptiveBlockSize(), settings.adaptiveC());
            log.debug("Adaptive threshold applied (block={}, C={})",
                    settings.adaptiveBlockSize(), settings.adaptiveC());
        } else {
            int thr = otsuThreshold(gray);
            log.debug("Otsu threshold: {}", thr);
            dark = new boolean[gray.length];
            for (int i = 0; i < gray.length; i++) {
                dark[i] = gray[i] <= thr;
            }
        }

        if (settings.noiseMinArea() > 1) {
            dark = removeSmallRegions(dark, w, h, settings.noiseMinArea());
        }
        return new BinaryMask(w, h, dark);
    }

    static int[] toGray(BufferedImage input) {
        final int w = input.getWidth(), h = input.getHeight(), n = w * h;
        int[] argb = new int[n];
        input.getRGB(0, 0, w, h, argb, 0, w);

        int[] gray = new int[n];
        for (int i = 0; i < n; i++) {
            int p = argb[i];
            int r = (p >> 16) & 0xFF, g = (p >> 8) & 0xFF, b = p & 0xFF;
            gray[i] = (int) Math.round(0.2126 * r + 0.7152 * g + 0.0722 * b);
        }
        return gray;
    }

    static int otsuThreshold(int[] gray) {
        int[] hist = new int[256];
        for (int v : gray) hist[v & 0xFF]++;

        int total = gray.length;
        long sumAll = 0;
        for (int i = 0; i < 256; i++) sumAll += (long) i * hist[i];

        long sumB = 0;
        int wB = 0;
        double maxBetween = -1.0;
        int threshold = 0;

        for (int t = 0; t < 256; t++) {
            wB += hist[t];
            if (wB == 0) continue;

            int wF = total - wB;
            if (wF == 0) break;

            sumB += (long) t * hist[t];
            double mB = sumB / (double) wB;
            double mF = (sumAll - sumB) / (double) wF;
            double between = (double) wB * wF * (mB - mF) * (mB - mF);

            if (between > maxBetween) {
                maxBetween = between;
                threshold = t;
            }
        }
        return threshold;
    }

    /** Dark where the pixel is at least {@code c} below the mean of its block. */
    static boolean[] adaptiveMeanThreshold(int[] gray, int w, int h, int blockSize, double c) {
        long[] integral = new long[(w + 1) * (h + 1)];
        for (int y = 0; y < h; y++) {
            long rowSum = 0;
            for (int x = 0; x < w; x++) {
                rowSum += gray[y * w + x];
                integral[(y + 1) * (w + 1) + (x + 1)] = integral[y * (w + 1) + (x + 1)] + rowSum;
            }
        }

        int half = blockSize / 2;
        boolean[] dark = new boolean[w * h];
        for (int y = 0; y < h; y++) {
            int y0 = Math.max(0, y - half), y1 = Math.min(h - 1, y + half);
            for (int x = 0; x < w; x++) {
                int x0 = Math.max(0, x - half), x1 = Math.min(w - 1, x + half);
                long sum = integral[(y1 + 1) * (w + 1) + (x1 + 1)]
                        - integral[y0 * (w + 1) + (x1 + 1)]
                        - integral[(y1 + 1) * (w + 1) + x0]
                        + integral[y0 * (w + 1) + x0];
                int count = (x1 - x0 + 1) * (y1 - y0 + 1);
                double mean = sum / (double) count;
                dark[y * w + x] = gray[y * w + x] <= mean - c;
            }
        }
        return dark;
    }

    private static boolean[] removeSmallRegions(boolean[] mask, int w, int h, int minSize) {
        boolean[] result = new boolean[w * h];
        boolean[] visited = new boolean[w * h];
        ArrayDeque<Point> queue = new ArrayDeque<>();
        int removed = 0;

        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int idx = y * w + x;
                if (!mask[idx] || visited[idx]) continue;

                List<Point> region = new ArrayList<>();
                queue.clear();
                queue.add(new Point(x, y));
                visited[idx] = true;

                while (!queue.isEmpty()) {
                    Point p = queue.removeFirst();
                    region.add(p);

                    int[][] dirs = {{0, -1}, {0, 1}, {-1, 0}, {1, 0}};
                    for (int[] dir : dirs) {
                        int nx = p.x + dir[0];
                        int ny = p.y + dir[1];
                        if (nx >= 0 && nx < w && ny >= 0 && ny < h) {
                            int nIdx = ny * w + nx;
                            if (mask[nIdx] && !visited[nIdx]) {
                                visited[nIdx] = true;
                                queue.add(new Point(nx, ny));
                            }
                        }
                    }
                }

                if (region.size() >= minSize) {
                    for (Point p : region) {
                        result[p.y * w + p.x] = true;
                    }
                } else {
                    removed++;
                }
            }
        }

        if (removed > 0) {
            log.debug("Removed {} specks smaller than {} pixels", removed, minSize);
        }
        return result;
    }
}
