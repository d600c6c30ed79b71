package com.example.autocount.service;

import com.example.autocount.exception.InvalidInputException;
import com.example.autocount.model.BoundingBox;
import com.example.autocount.model.NormalizedBox;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Rect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Cuts a symbol template out of a rendered page using a selection expressed in normalized page
 * coordinates.
 */
@Component
public class TemplateExtractor {

    private static final Logger log = LoggerFactory.getLogger(TemplateExtractor.class);

    public Mat crop(Mat page, NormalizedBox selection) {
        if (page == null || page.empty()) {
            throw new InvalidInputException("Page image is empty");
        }
        BoundingBox region = toPixels(selection, page.cols(), page.rows());
        try (Rect rect = new Rect(region.x(), region.y(), region.width(), region.height());
             Mat roi = new Mat(page, rect)) {
            log.debug("Extracted {}x{} template at ({}, {})", region.width(), region.height(), region.x(), region.y());
            return roi.clone();
        }
    }

    /**
     * Converts the selection to pixels. The origin is clamped into the page and the size is
     * clamped to what remains of the page past the origin.
     */
    public static BoundingBox toPixels(NormalizedBox selection, int pageWidth, int pageHeight) {
        if (selection == null) {
            throw new InvalidInputException("Selection box is required");
        }
        requireFraction("x", selection.x());
        requireFraction("y", selection.y());
        requireFraction("width", selection.width());
        requireFraction("height", selection.height());

        int x = clamp((int) (selection.x() * pageWidth), 0, pageWidth - 1);
        int y = clamp((int) (selection.y() * pageHeight), 0, pageHeight - 1);
        int width = Math.min((int) (selection.width() * pageWidth), pageWidth - x);
        int height = Math.min((int) (selection.height() * pageHeight), pageHeight - y);
        if (width <= 0 || height <= 0) {
            throw new InvalidInputException("Selection box covers no pixels");
        }
        return new BoundingBox(x, y, width, height);
    }

    private static void requireFraction(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new InvalidInputException("Selection " + name + " must be between 0 and 1, got " + value);
        }
    }

    private static int clamp(int value, int min, int max) {
        if (value < min) {
            return min;
        }
        if (value > max) {
            return max;
        }
        return value;
    }
}
