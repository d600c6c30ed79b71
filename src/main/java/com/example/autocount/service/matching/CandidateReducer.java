package com.example.autocount.service.matching;

import com.example.autocount.model.BoundingBox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Collapses the pooled scan output into a non-overlapping match set. Two greedy passes run in
 * ranking order: distance clustering removes the blob of neighbouring windows around each peak,
 * then overlap suppression removes competing orientation hypotheses at the same location.
 */
public class CandidateReducer {

    private static final Logger log = LoggerFactory.getLogger(CandidateReducer.class);

    private final double clusterDistanceFactor;
    private final double overlapThreshold;

    public CandidateReducer(double clusterDistanceFactor, double overlapThreshold) {
        if (Double.isNaN(clusterDistanceFactor) || clusterDistanceFactor <= 0) {
            throw new IllegalArgumentException("Cluster distance factor must be positive, got " + clusterDistanceFactor);
        }
        // matches may never overlap by more than half of the smaller footprint
        if (Double.isNaN(overlapThreshold) || overlapThreshold <= 0 || overlapThreshold > 0.5) {
            throw new IllegalArgumentException("Overlap threshold must be in (0, 0.5], got " + overlapThreshold);
        }
        this.clusterDistanceFactor = clusterDistanceFactor;
        this.overlapThreshold = overlapThreshold;
    }

    public List<Match> reduce(List<Detection> detections, int imageWidth, int imageHeight) {
        if (detections.isEmpty()) {
            return List.of();
        }
        List<Detection> clustered = clusterByDistance(detections);
        List<Detection> kept = suppressOverlaps(clustered);
        log.debug("Reduced {} detections to {} clusters and {} matches", detections.size(), clustered.size(), kept.size());

        List<Match> matches = new ArrayList<>(kept.size());
        for (Detection detection : kept) {
            BoundingBox pixels = new BoundingBox(detection.x(), detection.y(), detection.width(), detection.height());
            matches.add(new Match(matches.size(), detection.confidence(), pixels.normalize(imageWidth, imageHeight),
                    pixels, detection.orientation()));
        }
        return matches;
    }

    /**
     * Accepts a detection only when its footprint center is at least {@code factor * max(w, h)}
     * away from every center accepted before it.
     */
    List<Detection> clusterByDistance(List<Detection> detections) {
        List<Detection> ranked = ranked(detections);
        List<Detection> centers = new ArrayList<>();
        for (Detection candidate : ranked) {
            double minDistance = Math.max(candidate.width(), candidate.height()) * clusterDistanceFactor;
            boolean isolated = true;
            for (Detection center : centers) {
                double dx = candidate.centerX() - center.centerX();
                double dy = candidate.centerY() - center.centerY();
                if (Math.hypot(dx, dy) < minDistance) {
                    isolated = false;
                    break;
                }
            }
            if (isolated) {
                centers.add(candidate);
            }
        }
        return centers;
    }

    /**
     * Keeps a detection only when it overlaps every kept rectangle by at most the configured ratio
     * of the smaller of the two areas.
     */
    List<Detection> suppressOverlaps(List<Detection> detections) {
        List<Detection> ranked = ranked(detections);
        List<Detection> kept = new ArrayList<>();
        for (Detection candidate : ranked) {
            boolean clear = true;
            for (Detection accepted : kept) {
                if (overlapRatio(candidate, accepted) > overlapThreshold) {
                    clear = false;
                    break;
                }
            }
            if (clear) {
                kept.add(candidate);
            }
        }
        return kept;
    }

    static double overlapRatio(Detection a, Detection b) {
        long x1 = Math.max(a.x(), b.x());
        long y1 = Math.max(a.y(), b.y());
        long x2 = Math.min((long) a.x() + a.width(), (long) b.x() + b.width());
        long y2 = Math.min((long) a.y() + a.height(), (long) b.y() + b.height());
        long intersection = Math.max(0, x2 - x1) * Math.max(0, y2 - y1);
        long smaller = Math.min(a.area(), b.area());
        if (smaller <= 0) {
            return 0d;
        }
        return intersection / (double) smaller;
    }

    private static List<Detection> ranked(List<Detection> detections) {
        List<Detection> ranked = new ArrayList<>(detections);
        ranked.sort(Detection.RANKING);
        return ranked;
    }
}
