package com.example.autocount.service.matching;

import com.example.autocount.exception.InvalidInputException;
import org.bytedeco.javacpp.indexer.DoubleIndexer;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Point2f;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.bytedeco.opencv.opencv_core.Size;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Produces rotated copies of a template. The output canvas is sized to contain every rotated
 * corner, so right angles swap or keep the dimensions and nothing is clipped.
 */
public class TemplateRotator {

    private static final Logger log = LoggerFactory.getLogger(TemplateRotator.class);

    /**
     * Builds one oriented template per requested orientation, in the order given. On failure
     * every template created so far is released.
     */
    public List<OrientedTemplate> orient(Mat template, List<Orientation> orientations) {
        requireTemplate(template);
        if (orientations == null || orientations.isEmpty()) {
            throw new InvalidInputException("At least one search orientation is required");
        }
        List<OrientedTemplate> oriented = new ArrayList<>(orientations.size());
        try {
            for (Orientation orientation : orientations) {
                oriented.add(new OrientedTemplate(orientation, rotate(template, orientation.degrees())));
            }
        } catch (RuntimeException ex) {
            oriented.forEach(OrientedTemplate::close);
            throw ex;
        }
        log.debug("Prepared {} oriented templates from {}x{} source", oriented.size(), template.cols(), template.rows());
        return oriented;
    }

    /**
     * Rotates the template counter-clockwise about its center. Multiples of 90 degrees are
     * remapped pixel for pixel; other angles are resampled with an affine warp.
     */
    public Mat rotate(Mat template, double angleDegrees) {
        requireTemplate(template);
        double normalized = ((angleDegrees % 360) + 360) % 360;
        if (normalized == 0) {
            return template.clone();
        }
        if (normalized == 90 || normalized == 180 || normalized == 270) {
            Mat rotated = new Mat();
            opencv_core.rotate(template, rotated, rightAngleCode((int) normalized));
            return rotated;
        }
        return warp(template, normalized);
    }

    /**
     * Dimensions of the smallest canvas that contains the template rotated by the given angle.
     */
    public static Canvas canvasFor(int width, int height, double angleDegrees) {
        double radians = Math.toRadians(angleDegrees);
        double sin = Math.abs(Math.sin(radians));
        double cos = Math.abs(Math.cos(radians));
        int newWidth = (int) Math.round(height * sin + width * cos);
        int newHeight = (int) Math.round(height * cos + width * sin);
        return new Canvas(newWidth, newHeight);
    }

    private Mat warp(Mat template, double angleDegrees) {
        int width = template.cols();
        int height = template.rows();
        Canvas canvas = canvasFor(width, height, angleDegrees);
        Point2f center = new Point2f(width / 2.0f, height / 2.0f);
        Mat matrix = opencv_imgproc.getRotationMatrix2D(center, angleDegrees, 1.0);
        try (DoubleIndexer indexer = matrix.createIndexer()) {
            indexer.put(0, 2, indexer.get(0, 2) + canvas.width() / 2.0 - width / 2.0);
            indexer.put(1, 2, indexer.get(1, 2) + canvas.height() / 2.0 - height / 2.0);
        }
        Mat rotated = new Mat();
        try {
            opencv_imgproc.warpAffine(template, rotated, matrix, new Size(canvas.width(), canvas.height()),
                    opencv_imgproc.INTER_LINEAR, opencv_core.BORDER_REPLICATE, new Scalar());
        } finally {
            matrix.close();
            center.close();
        }
        return rotated;
    }

    private static int rightAngleCode(int degrees) {
        switch (degrees) {
            case 90:
                return opencv_core.ROTATE_90_COUNTERCLOCKWISE;
            case 180:
                return opencv_core.ROTATE_180;
            case 270:
                return opencv_core.ROTATE_90_CLOCKWISE;
            default:
                throw new IllegalArgumentException("Not a right angle: " + degrees);
        }
    }

    private static void requireTemplate(Mat template) {
        if (template == null || template.empty() || template.cols() <= 0 || template.rows() <= 0) {
            throw new InvalidInputException("Template image is empty");
        }
    }

    public record Canvas(int width, int height) {
    }
}
