package com.project.omr.DTOs;

import java.util.Arrays;

public record BubbleCandidate(
        int x,
        int y,
        int width,
        int height,
        boolean[] region,       // row-major over the bounding box: component, holes and inscribed ellipse
        int regionPixels
) {

    public BubbleCandidate {
        region = region.clone();
    }

    @Override
    public boolean[] region() {
        return region.clone();
    }

    public double centerX() {
        return x + width / 2.0;
    }

    public double centerY() {
        return y + height / 2.0;
    }

    public int boundingArea() {
        return width * height;
    }

    public double aspectRatio() {
        return width / (double) height;
    }

    public boolean inRegion(int imageX, int imageY) {
        int lx = imageX - x;
        int ly = imageY - y;
        if (lx < 0 || ly < 0 || lx >= width || ly >= height) return false;
        return region[ly * width + lx];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BubbleCandidate)) return false;
        BubbleCandidate other = (BubbleCandidate) o;
        return x == other.x && y == other.y && width == other.width && height == other.height
                && regionPixels == other.regionPixels && Arrays.equals(region, other.region);
    }

    @Override
    public int hashCode() {
        int result = 31 * (31 * (31 * x + y) + width) + height;
        return 31 * result + Arrays.hashCode(region);
    }

    @Override
    public String toString() {
        return "BubbleCandidate[x=" + x + ", y=" + y + ", " + width + "x" + height + ", region=" + regionPixels + "]";
    }
}
