package com.example.autocount.service.matching;

import com.example.autocount.exception.InvalidInputException;
import org.bytedeco.opencv.global.opencv_imgproc;

import java.util.Locale;

/**
 * Correlation scoring functions supported by the scanner. Both are normalized so that 1.0 is a
 * perfect match once {@link #toScore(float)} has been applied.
 */
public enum MatchMethod {
    NORMALIZED_CORRELATION(opencv_imgproc.TM_CCOEFF_NORMED, "TM_CCOEFF_NORMED", false),
    NORMALIZED_SQUARED_DIFFERENCE(opencv_imgproc.TM_SQDIFF_NORMED, "TM_SQDIFF_NORMED", true);

    private static final String OPENCV_PREFIX = "CV2.";

    private final int opencvCode;
    private final String opencvName;
    private final boolean inverted;

    MatchMethod(int opencvCode, String opencvName, boolean inverted) {
        this.opencvCode = opencvCode;
        this.opencvName = opencvName;
        this.inverted = inverted;
    }

    public int opencvCode() {
        return opencvCode;
    }

    /**
     * Converts a raw {@code matchTemplate} value into a higher-is-better score. Squared-difference
     * values are distances, so they are flipped before any threshold comparison.
     */
    public double toScore(float raw) {
        double score = inverted ? 1.0 - raw : raw;
        return Math.min(score, 1.0);
    }

    /**
     * Resolves a method by enum name or by its OpenCV constant name, with or without the
     * {@code cv2.} prefix.
     */
    public static MatchMethod parse(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidInputException("Match method must not be blank");
        }
        String candidate = name.trim().toUpperCase(Locale.ROOT);
        if (candidate.startsWith(OPENCV_PREFIX)) {
            candidate = candidate.substring(OPENCV_PREFIX.length());
        }
        for (MatchMethod method : values()) {
            if (method.name().equals(candidate) || method.opencvName.equals(candidate)) {
                return method;
            }
        }
        throw new InvalidInputException("Unsupported match method: " + name);
    }
}
