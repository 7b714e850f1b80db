package com.project.omr.service;

import com.project.omr.DTOs.BinaryMask;
import com.project.omr.config.OmrProperties;
import com.project.omr.exceptions.ImageLoadException;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;

@Component
public class OpenCVPreprocessor implements Preprocessor {
    private static final Logger log = LoggerFactory.getLogger(OpenCVPreprocessor.class);

    private static final boolean NATIVE_LOADED;

    static {
        boolean loaded = false;
        try {
            nu.pattern.OpenCV.loadLocally();
            loaded = true;
            log.info("OpenCV loaded successfully");
        } catch (Exception | UnsatisfiedLinkError e) {
            log.error("Failed to load OpenCV", e);
        }
        NATIVE_LOADED = loaded;
    }

    public static boolean isAvailable() {
        return NATIVE_LOADED;
    }

    @Override
    public OmrProperties.PreprocessorType type() {
        return OmrProperties.PreprocessorType.OPENCV;
    }

    @Override
    public BinaryMask preprocess(BufferedImage input, OmrProperties settings) {
        Preprocessor.requireImage(input);
        if (!NATIVE_LOADED) {
            throw new ImageLoadException("OpenCV native library is not available; use the java preprocessor.");
        }

        Mat image = bufferedImageToMat(input);
        Mat gray = new Mat();
        Mat binary = new Mat();
        Mat labels = new Mat();
        Mat stats = new Mat();
        Mat centroids = new Mat();
        try {
            Imgproc.cvtColor(image, gray, Imgproc.COLOR_BGR2GRAY);

            if (settings.thresholdMode() == OmrProperties.ThresholdMode.ADAPTIVE_MEAN) {
                Imgproc.adaptiveThreshold(gray, binary, 255, Imgproc.ADAPTIVE_THRESH_MEAN_C,
                        Imgproc.THRESH_BINARY_INV, settings.adaptiveBlockSize(), settings.adaptiveC());
            } else {
                double thr = Imgproc.threshold(gray, binary, 0, 255, Imgproc.THRESH_BINARY_INV + Imgproc.THRESH_OTSU);
                log.debug("Otsu threshold (OpenCV): {}", thr);
            }

            int count = Imgproc.connectedComponentsWithStats(binary, labels, stats, centroids, 4, CvType.CV_32S);
            boolean[] keep = new boolean[count];
            for (int label = 1; label < count; label++) {
                int area = (int) stats.get(label, Imgproc.CC_STAT_AREA)[0];
                keep[label] = area >= settings.noiseMinArea();
            }

            int w = input.getWidth(), h = input.getHeight();
            int[] labelData = new int[w * h];
            labels.get(0, 0, labelData);

            boolean[] dark = new boolean[w * h];
            for (int i = 0; i < labelData.length; i++) {
                int label = labelData[i];
                dark[i] = label != 0 && keep[label];
            }
            return new BinaryMask(w, h, dark);
        } finally {
            image.release();
            gray.release();
            binary.release();
            labels.release();
            stats.release();
            centroids.release();
        }
    }

    private Mat bufferedImageToMat(BufferedImage image) {
        BufferedImage bgrImage = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_3BYTE_BGR);
        Graphics2D graphics = bgrImage.createGraphics();
        graphics.drawImage(image, 0, 0, null);
        graphics.dispose();
        byte[] pixels = ((DataBufferByte) bgrImage.getRaster().getDataBuffer()).getData();
        Mat mat = new Mat(image.getHeight(), image.getWidth(), CvType.CV_8UC3);
        mat.put(0, 0, pixels);
        return mat;
    }
}
