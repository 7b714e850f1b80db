package com.project.omr.service;

import com.project.omr.DTOs.BinaryMask;
import com.project.omr.config.OmrProperties;
import com.project.omr.exceptions.ImageLoadException;

import java.awt.image.BufferedImage;

public interface Preprocessor {

    OmrProperties.PreprocessorType type();

    BinaryMask preprocess(BufferedImage image, OmrProperties settings);

    static void requireImage(BufferedImage image) {
        if (image == null) {
            throw new ImageLoadException("No image supplied.");
        }
        if (image.getWidth() <= 0 || image.getHeight() <= 0) {
            throw new ImageLoadException("Image has zero area: " + image.getWidth() + "x" + image.getHeight());
        }
    }
}
