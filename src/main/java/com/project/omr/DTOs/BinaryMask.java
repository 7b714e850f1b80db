package com.project.omr.DTOs;

import java.util.Arrays;

public record BinaryMask(int width, int height, boolean[] dark) {

    public BinaryMask {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Mask must have positive dimensions: " + width + "x" + height);
        }
        if (dark == null || dark.length != width * height) {
            throw new IllegalArgumentException("Mask data does not match " + width + "x" + height);
        }
        dark = dark.clone();
    }

    @Override
    public boolean[] dark() {
        return dark.clone();
    }

    public boolean isDark(int x, int y) {
        return dark[y * width + x];
    }

    public int darkCount() {
        int count = 0;
        for (boolean pixel : dark) {
            if (pixel) count++;
        }
        return count;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BinaryMask)) return false;
        BinaryMask other = (BinaryMask) o;
        return width == other.width && height == other.height && Arrays.equals(dark, other.dark);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(dark);
    }

    @Override
    public String toString() {
        return "BinaryMask[" + width + "x" + height + ", dark=" + darkCount() + "]";
    }
}
