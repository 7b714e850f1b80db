package com.project.omr.service;

import com.project.omr.exceptions.ImageLoadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.imageio.ImageIO;

@Component
public class SheetImageLoader {
    private static final Logger log = LoggerFactory.getLogger(SheetImageLoader.class);

    public BufferedImage load(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            throw new ImageLoadException("Image file not found: " + file);
        }
        try (InputStream in = Files.newInputStream(file)) {
            return load(in, file.getFileName().toString());
        } catch (IOException e) {
            throw new ImageLoadException("Cannot read image file " + file + ": " + e.getMessage(), e);
        }
    }

    public BufferedImage load(InputStream in, String name) {
        BufferedImage image;
        try {
            image = ImageIO.read(in);
        } catch (IOException e) {
            throw new ImageLoadException("Cannot decode image " + name + ": " + e.getMessage(), e);
        }

        if (image == null) {
            throw new ImageLoadException("File " + name + " is not a valid image or is corrupted.");
        }
        if (image.getWidth() <= 0 || image.getHeight() <= 0) {
            throw new ImageLoadException("Image " + name + " has zero area.");
        }

        log.debug("Image {} loaded: {}x{}", name, image.getWidth(), image.getHeight());
        return image;
    }
}
