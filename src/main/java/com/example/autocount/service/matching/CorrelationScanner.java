package com.example.autocount.service.matching;

import com.example.autocount.exception.InvalidInputException;
import com.example.autocount.exception.ScanFailureException;
import com.example.autocount.exception.TemplateTooLargeException;
import com.example.autocount.exception.VisualSearchException;
import org.bytedeco.javacpp.indexer.FloatIndexer;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Rect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * Scores every window position of one oriented template against the target and keeps those at
 * or above the threshold. The target is processed in horizontal bands of result rows so that a
 * cancelled search stops within one band.
 */
public class CorrelationScanner {

    private static final Logger log = LoggerFactory.getLogger(CorrelationScanner.class);

    private static final int SEQUENCE_ORIENTATION_SHIFT = 40;

    private final int bandRows;

    public CorrelationScanner(int bandRows) {
        if (bandRows <= 0) {
            throw new IllegalArgumentException("Band rows must be positive");
        }
        this.bandRows = bandRows;
    }

    /**
     * @param orientationIndex position of the orientation in the search, used to order
     *                         detections from different scans deterministically
     * @param limit            maximum number of detections to return, best first
     */
    public List<Detection> scan(Mat target, OrientedTemplate template, double threshold, MatchMethod method,
                                int orientationIndex, int limit, ScanCancellation cancellation) {
        validateThreshold(threshold);
        if (target == null || target.empty()) {
            throw new InvalidInputException("Target image is empty");
        }
        int imageWidth = target.cols();
        int imageHeight = target.rows();
        if (template.width() > imageWidth || template.height() > imageHeight) {
            throw new TemplateTooLargeException(template.width(), template.height(), imageWidth, imageHeight);
        }

        long start = System.nanoTime();
        int resultRows = imageHeight - template.height() + 1;
        int resultCols = imageWidth - template.width() + 1;
        long sequenceBase = (long) orientationIndex << SEQUENCE_ORIENTATION_SHIFT;
        TopDetections collected = new TopDetections(limit);
        try {
            for (int bandStart = 0; bandStart < resultRows; bandStart += bandRows) {
                cancellation.checkpoint();
                int rows = Math.min(bandRows, resultRows - bandStart);
                Rect region = new Rect(0, bandStart, imageWidth, rows + template.height() - 1);
                try (Mat band = new Mat(target, region); Mat scores = new Mat()) {
                    opencv_imgproc.matchTemplate(band, template.image(), scores, method.opencvCode());
                    collect(scores, bandStart, resultCols, template, threshold, method, sequenceBase, collected, cancellation);
                } finally {
                    region.close();
                }
            }
        } catch (VisualSearchException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new ScanFailureException("Correlation scan failed for orientation "
                    + template.orientation().degrees() + ": " + ex.getMessage(), ex);
        }
        log.debug("Scan at {} degrees kept {} detections in {} ms", template.orientation().degrees(),
                collected.size(), Duration.ofNanos(System.nanoTime() - start).toMillis());
        return collected.toRankedList();
    }

    private void collect(Mat scores, int bandStart, int resultCols, OrientedTemplate template, double threshold,
                         MatchMethod method, long sequenceBase, TopDetections collected, ScanCancellation cancellation) {
        try (FloatIndexer indexer = scores.createIndexer()) {
            int rows = scores.rows();
            int cols = scores.cols();
            for (int row = 0; row < rows; row++) {
                cancellation.checkpoint();
                int y = bandStart + row;
                for (int col = 0; col < cols; col++) {
                    double score = method.toScore(indexer.get(row, col));
                    if (Double.isNaN(score) || score < threshold) {
                        continue;
                    }
                    long sequence = sequenceBase + (long) y * resultCols + col;
                    collected.offer(new Detection(col, y, template.width(), template.height(), score,
                            template.orientation(), sequence));
                }
            }
        }
    }

    static void validateThreshold(double threshold) {
        if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
            throw new InvalidInputException("Confidence threshold must be between 0 and 1, got " + threshold);
        }
    }
}
