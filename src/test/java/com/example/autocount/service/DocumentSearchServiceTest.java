package com.example.autocount.service;

import com.example.autocount.TestImages;
import com.example.autocount.config.VisualSearchProperties;
import com.example.autocount.exception.InvalidInputException;
import com.example.autocount.model.DocumentSearchRequest;
import com.example.autocount.model.DocumentSearchResponse;
import com.example.autocount.model.MatchResult;
import com.example.autocount.model.PageFailure;
import com.example.autocount.service.matching.CandidateReducer;
import com.example.autocount.service.matching.CorrelationScanner;
import com.example.autocount.service.matching.Orientation;
import com.example.autocount.service.matching.TemplateRotator;
import com.example.autocount.service.matching.VisualSearchEngine;
import org.bytedeco.opencv.opencv_core.Mat;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocumentSearchServiceTest {

    @TempDir
    Path tempDir;

    private DocumentSearchService service;
    private Path templatePath;

    @BeforeEach
    void setUp() {
        VisualSearchEngine engine = new VisualSearchEngine(new TemplateRotator(), new CorrelationScanner(256),
                new CandidateReducer(0.8, 0.5), Runnable::run, List.of(Orientation.values()), 1000);
        service = new DocumentSearchService(new VisualSearchService(engine, new VisualSearchProperties()));
        templatePath = TestImages.write(tempDir, "template.png", TestImages.symbol());
    }

    @Test
    void mergesPagesAndSkipsFailingOnes() {
        Path first = page("page-1.png", 10, 10);
        Path tooSmall = TestImages.write(tempDir, "page-2.png", TestImages.blank(30, 30));
        Path third = page("page-3.png", 120, 60);

        DocumentSearchResponse response = service.search(new DocumentSearchRequest(templatePath.toString(),
                List.of(first.toString(), tooSmall.toString(), third.toString(), tempDir.resolve("gone.png").toString()),
                0.95, null, null));

        assertThat(response.success()).isTrue();
        assertThat(response.pagesSearched()).isEqualTo(2);
        assertThat(response.pagesFailed()).extracting(PageFailure::pageNumber).containsExactly(2, 4);
        assertThat(response.pagesFailed()).extracting(PageFailure::errorType)
                .containsExactly("TEMPLATE_TOO_LARGE", "INVALID_INPUT");
        assertThat(response.totalMatches()).isEqualTo(2);
        assertThat(response.matches()).extracting(MatchResult::pageNumber).containsExactlyInAnyOrder(1, 3);
        assertThat(response.matches()).extracting(MatchResult::id).containsExactly(0, 1);
        assertThat(response.threshold()).isEqualTo(0.95);
    }

    @Test
    void limitsMergedMatches() {
        Path first = page("page-1.png", 10, 10);
        Path second = page("page-2.png", 100, 100);

        DocumentSearchResponse response = service.search(new DocumentSearchRequest(templatePath.toString(),
                List.of(first.toString(), second.toString()), 0.95, null, 1));

        assertThat(response.totalMatches()).isEqualTo(1);
        assertThat(response.matches().get(0).id()).isZero();
    }

    @Test
    void unreadableTemplateFailsWholeRequest() {
        Path first = page("page-1.png", 10, 10);

        assertThatThrownBy(() -> service.search(new DocumentSearchRequest(tempDir.resolve("none.png").toString(),
                List.of(first.toString()), 0.95, null, null)))
                .isInstanceOf(InvalidInputException.class);
    }

    private Path page(String name, int x, int y) {
        Mat page = TestImages.blank(200, 200);
        TestImages.paste(page, TestImages.symbol(), x, y);
        return TestImages.write(tempDir, name, page);
    }
}
