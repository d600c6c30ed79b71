package com.example.autocount.service.matching;

import com.example.autocount.TestImages;
import com.example.autocount.exception.InvalidInputException;
import com.example.autocount.exception.ScanFailureException;
import com.example.autocount.exception.TemplateTooLargeException;
import org.bytedeco.opencv.opencv_core.Mat;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class VisualSearchEngineTest {

    private static final List<Orientation> ALL = List.of(Orientation.values());

    private ExecutorService executor;
    private VisualSearchEngine engine;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        engine = newEngine(new CorrelationScanner(128));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void findsSinglePlacementAtExactPosition() {
        Mat target = TestImages.blank(1000, 800);
        TestImages.paste(target, TestImages.symbol(), 100, 100);

        SearchResult result = engine.search(target, TestImages.symbol(), 0.99,
                MatchMethod.NORMALIZED_CORRELATION, ScanCancellation.none());

        assertThat(result.matches()).hasSize(1);
        Match match = result.matches().get(0);
        assertThat(match.pixelBoundingBox().x()).isEqualTo(100);
        assertThat(match.pixelBoundingBox().y()).isEqualTo(100);
        assertThat(match.pixelBoundingBox().width()).isEqualTo(50);
        assertThat(match.pixelBoundingBox().height()).isEqualTo(50);
        assertThat(match.orientation()).isEqualTo(Orientation.DEG_0);
        assertThat(match.confidence()).isEqualTo(1.0, within(0.005));
        assertThat(result.imageWidth()).isEqualTo(1000);
        assertThat(result.imageHeight()).isEqualTo(800);
        assertThat(result.templateWidth()).isEqualTo(50);
    }

    @Test
    void findsTwoPlacementsWithDistinctIds() {
        Mat target = TestImages.blank(1000, 800);
        TestImages.paste(target, TestImages.symbol(), 100, 100);
        TestImages.paste(target, TestImages.symbol(), 500, 500);

        SearchResult result = engine.search(target, TestImages.symbol(), 0.99,
                MatchMethod.NORMALIZED_CORRELATION, ScanCancellation.none());

        assertThat(result.matches()).hasSize(2);
        assertThat(result.matches()).extracting(Match::id).containsExactly(0, 1);
        assertThat(result.matches())
                .extracting(match -> match.pixelBoundingBox().x() + "," + match.pixelBoundingBox().y())
                .containsExactlyInAnyOrder("100,100", "500,500");
    }

    @Test
    void reportsOrientationOfRotatedPlacement() {
        Mat target = TestImages.blank(600, 400);
        TestImages.paste(target, TestImages.rotate90CounterClockwise(TestImages.symbol()), 300, 200);

        SearchResult result = engine.search(target, TestImages.symbol(), 0.99,
                MatchMethod.NORMALIZED_CORRELATION, ScanCancellation.none());

        assertThat(result.matches()).hasSize(1);
        assertThat(result.matches().get(0).orientation()).isEqualTo(Orientation.DEG_90);
        assertThat(result.matches().get(0).pixelBoundingBox().x()).isEqualTo(300);
        assertThat(result.matches().get(0).pixelBoundingBox().y()).isEqualTo(200);
    }

    @Test
    void templateOfTargetSizeMatchesOnlyAtOrigin() {
        Mat symbol = TestImages.symbol();

        SearchResult result = engine.search(symbol, TestImages.symbol(), 0.99,
                MatchMethod.NORMALIZED_CORRELATION, ScanCancellation.none());

        assertThat(result.matches()).hasSize(1);
        assertThat(result.matches().get(0).pixelBoundingBox().x()).isZero();
        assertThat(result.matches().get(0).pixelBoundingBox().y()).isZero();
    }

    @Test
    void lowThresholdOutputStillHonoursThresholdBoundsAndOverlap() {
        Mat target = TestImages.noise(300, 200, 42L);
        TestImages.paste(target, TestImages.symbol(), 40, 40);
        TestImages.paste(target, TestImages.symbol(), 200, 100);

        SearchResult result = engine.search(target, TestImages.symbol(), 0.2,
                MatchMethod.NORMALIZED_CORRELATION, ScanCancellation.none());

        assertThat(result.matches()).isNotEmpty();
        assertThat(result.rawDetections()).isLessThanOrEqualTo(1000);
        List<Match> matches = result.matches();
        for (int i = 0; i < matches.size(); i++) {
            Match match = matches.get(i);
            assertThat(match.confidence()).isGreaterThanOrEqualTo(0.2);
            assertThat(match.pixelBoundingBox().x() + match.pixelBoundingBox().width()).isLessThanOrEqualTo(300);
            assertThat(match.pixelBoundingBox().y() + match.pixelBoundingBox().height()).isLessThanOrEqualTo(200);
            for (int j = i + 1; j < matches.size(); j++) {
                assertThat(CandidateReducer.overlapRatio(toDetection(match), toDetection(matches.get(j))))
                        .isLessThanOrEqualTo(0.5);
            }
        }
        assertThat(matches).extracting(Match::confidence).isSortedAccordingTo((a, b) -> Double.compare(b, a));
    }

    @Test
    void identicalInputsGiveIdenticalResults() {
        Mat target = TestImages.noise(240, 180, 3L);
        TestImages.paste(target, TestImages.symbol(), 60, 70);

        SearchResult first = engine.search(target, TestImages.symbol(), 0.3,
                MatchMethod.NORMALIZED_CORRELATION, ScanCancellation.none());
        SearchResult second = engine.search(target, TestImages.symbol(), 0.3,
                MatchMethod.NORMALIZED_CORRELATION, ScanCancellation.none());

        assertThat(second.matches()).isEqualTo(first.matches());
    }

    @Test
    void templateLargerThanTargetFails() {
        assertThatThrownBy(() -> engine.search(TestImages.blank(100, 100), TestImages.blank(200, 200), 0.8,
                MatchMethod.NORMALIZED_CORRELATION, ScanCancellation.none()))
                .isInstanceOf(TemplateTooLargeException.class);
    }

    @Test
    void templateThatOnlyFitsUprightFailsForQuarterTurns() {
        assertThatThrownBy(() -> engine.search(TestImages.blank(100, 60), TestImages.blank(80, 30), 0.8,
                MatchMethod.NORMALIZED_CORRELATION, ScanCancellation.none()))
                .isInstanceOf(TemplateTooLargeException.class)
                .hasMessage("Template (30x80) is larger than image (100x60)");
    }

    @Test
    void thresholdAboveOneFails() {
        assertThatThrownBy(() -> engine.search(TestImages.blank(100, 100), TestImages.symbol(), 1.1,
                MatchMethod.NORMALIZED_CORRELATION, ScanCancellation.none()))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    void emptyTemplateFails() {
        assertThatThrownBy(() -> engine.search(TestImages.blank(100, 100), new Mat(), 0.5,
                MatchMethod.NORMALIZED_CORRELATION, ScanCancellation.none()))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    void unexpectedScanErrorBecomesScanFailure() {
        CorrelationScanner failing = mock(CorrelationScanner.class);
        when(failing.scan(any(Mat.class), any(OrientedTemplate.class), anyDouble(), any(MatchMethod.class),
                anyInt(), anyInt(), any(ScanCancellation.class)))
                .thenThrow(new IllegalStateException("corrupt score map"));
        VisualSearchEngine failingEngine = newEngine(failing);

        assertThatThrownBy(() -> failingEngine.search(TestImages.blank(100, 100), TestImages.symbol(), 0.5,
                MatchMethod.NORMALIZED_CORRELATION, ScanCancellation.none()))
                .isInstanceOf(ScanFailureException.class)
                .hasMessageContaining("corrupt score map");
    }

    @Test
    void failingOrientationCancelsSlowerSiblings() {
        VisualSearchEngine slowEngine = newEngine(new FailLastOrientationScanner());

        long start = System.nanoTime();
        assertThatThrownBy(() -> slowEngine.search(TestImages.blank(100, 100), TestImages.symbol(), 0.5,
                MatchMethod.NORMALIZED_CORRELATION, ScanCancellation.none()))
                .isInstanceOf(ScanFailureException.class)
                .hasMessageContaining("score map unavailable");
        long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();

        assertThat(elapsedMs).isLessThan(1500);
    }

    @Test
    void pooledDetectionsAreCappedAcrossOrientationsBestFirst() {
        Mat target = TestImages.noise(300, 200, 11L);
        TestImages.paste(target, TestImages.symbol(), 120, 80);

        SearchResult result = engine.search(target, TestImages.symbol(), 0.0,
                MatchMethod.NORMALIZED_CORRELATION, ScanCancellation.none());

        assertThat(result.rawDetections()).isEqualTo(1000);
        assertThat(result.matches()).extracting(Match::confidence)
                .isSortedAccordingTo((a, b) -> Double.compare(b, a));
        Match best = result.matches().get(0);
        assertThat(best.pixelBoundingBox().x()).isEqualTo(120);
        assertThat(best.pixelBoundingBox().y()).isEqualTo(80);
        assertThat(best.orientation()).isEqualTo(Orientation.DEG_0);
        assertThat(best.confidence()).isEqualTo(1.0, within(0.005));
    }

    private VisualSearchEngine newEngine(CorrelationScanner scanner) {
        return new VisualSearchEngine(new TemplateRotator(), scanner, new CandidateReducer(0.8, 0.5),
                executor, ALL, 1000);
    }

    private static Detection toDetection(Match match) {
        return new Detection(match.pixelBoundingBox().x(), match.pixelBoundingBox().y(),
                match.pixelBoundingBox().width(), match.pixelBoundingBox().height(),
                match.confidence(), match.orientation(), match.id());
    }

    /**
     * Fails the last orientation at once while the others keep scanning for several seconds
     * unless they are cancelled.
     */
    private static final class FailLastOrientationScanner extends CorrelationScanner {

        FailLastOrientationScanner() {
            super(128);
        }

        @Override
        public List<Detection> scan(Mat target, OrientedTemplate template, double threshold, MatchMethod method,
                                    int orientationIndex, int limit, ScanCancellation cancellation) {
            if (orientationIndex == ALL.size() - 1) {
                throw new IllegalStateException("score map unavailable");
            }
            long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
            while (System.nanoTime() < deadline) {
                cancellation.checkpoint();
                try {
                    Thread.sleep(10);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Scan interrupted", ex);
                }
            }
            return List.of();
        }
    }
}
