package com.project.omr.service;

import com.project.omr.DTOs.BubbleCandidate;
import com.project.omr.DTOs.MarkStatus;
import com.project.omr.DTOs.QuestionResult;
import com.project.omr.DTOs.Row;
import com.project.omr.exceptions.OmrException;
import org.springframework.stereotype.Component;

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.util.List;
import javax.imageio.ImageIO;

@Component
public class DebugOverlayRenderer {

    static final Color MARKED_COLOR = new Color(0, 200, 0);
    static final Color AMBIGUOUS_COLOR = new Color(255, 140, 0);
    static final Color EMPTY_COLOR = new Color(255, 0, 0);
    private static final float FILL_ALPHA = 0.45f;

    public byte[] render(BufferedImage input, List<Row> rows, List<QuestionResult> results) {
        BufferedImage overlay = deepCopy(input);
        Graphics2D graphics = overlay.createGraphics();
        graphics.setStroke(new BasicStroke(2f));

        for (int r = 0; r < rows.size(); r++) {
            Row row = rows.get(r);
            QuestionResult result = results.get(r);
            for (int i = 0; i < row.bubbles().size(); i++) {
                BubbleCandidate bubble = row.bubbles().get(i);
                Color color = colorFor(result, Row.optionLetter(i));
                tint(overlay, bubble, color);
                graphics.setColor(color);
                graphics.drawRect(bubble.x() - 1, bubble.y() - 1, bubble.width() + 1, bubble.height() + 1);
            }
        }
        graphics.dispose();
        return toPng(overlay);
    }

    private static Color colorFor(QuestionResult result, String option) {
        if (result.status() == MarkStatus.AMBIGUOUS) return AMBIGUOUS_COLOR;
        if (result.status() == MarkStatus.MARKED && option.equals(result.option())) return MARKED_COLOR;
        return EMPTY_COLOR;
    }

    private static void tint(BufferedImage image, BubbleCandidate bubble, Color color) {
        for (int y = bubble.y(); y < bubble.y() + bubble.height(); y++) {
            for (int x = bubble.x(); x < bubble.x() + bubble.width(); x++) {
                if (!bubble.inRegion(x, y)) continue;

                int base = image.getRGB(x, y);
                int newRed = blend((base >> 16) & 0xFF, color.getRed(), FILL_ALPHA);
                int newGreen = blend((base >> 8) & 0xFF, color.getGreen(), FILL_ALPHA);
                int newBlue = blend(base & 0xFF, color.getBlue(), FILL_ALPHA);
                image.setRGB(x, y, (0xFF << 24) | (newRed << 16) | (newGreen << 8) | newBlue);
            }
        }
    }

    private static BufferedImage deepCopy(BufferedImage bi) {
        BufferedImage copy = new BufferedImage(bi.getWidth(), bi.getHeight(), BufferedImage.TYPE_INT_ARGB);
        Graphics2D graphics = copy.createGraphics();
        graphics.drawImage(bi, 0, 0, null);
        graphics.dispose();
        return copy;
    }

    private static int blend(int orig, int tint, float alpha) {
        return clamp(Math.round(alpha * tint + (1f - alpha) * orig));
    }

    private static int clamp(int v) {
        return (v < 0) ? 0 : Math.min(255, v);
    }

    private static byte[] toPng(BufferedImage img) {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            ImageIO.write(img, "png", baos);
            return baos.toByteArray();
        } catch (Exception e) {
            throw new OmrException("Failed to encode debug overlay", e);
        }
    }
}
