package com.project.omr.service;

import com.project.omr.DTOs.AnswerKey;
import com.project.omr.DTOs.BinaryMask;
import com.project.omr.DTOs.BubbleCandidate;
import com.project.omr.DTOs.DetectionResult;
import com.project.omr.DTOs.EvaluationResult;
import com.project.omr.DTOs.QuestionResult;
import com.project.omr.DTOs.Row;
import com.project.omr.config.OmrProperties;
import com.project.omr.exceptions.EmptyAnswerKeyException;
import com.project.omr.exceptions.OmrException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point of the engine: image in, answers (and optionally a score) out.
 *
 * <p>Each call runs preprocess, candidate detection, row clustering and fill
 * classification on call-local data only, so one instance can serve many
 * threads. Failures are reported as {@code status = "error"} results;
 * finding no rows is a success with zero questions.</p>
 */
@Service
public class OmrDetector {
    private static final Logger log = LoggerFactory.getLogger(OmrDetector.class);

    private final OmrProperties properties;
    private final Map<OmrProperties.PreprocessorType, Preprocessor> preprocessors;
    private final BubbleCandidateDetector candidateDetector;
    private final RowClusterer rowClusterer;
    private final AnswerResolver answerResolver;
    private final Evaluator evaluator;
    private final SheetImageLoader imageLoader;
    private final DebugOverlayRenderer overlayRenderer;
    private final PipelineObserver observer;

    public OmrDetector(OmrProperties properties,
                       List<Preprocessor> preprocessors,
                       BubbleCandidateDetector candidateDetector,
                       RowClusterer rowClusterer,
                       AnswerResolver answerResolver,
                       Evaluator evaluator,
                       SheetImageLoader imageLoader,
                       DebugOverlayRenderer overlayRenderer,
                       PipelineObserver observer) {
        this.properties = properties;
        this.preprocessors = new EnumMap<>(OmrProperties.PreprocessorType.class);
        for (Preprocessor preprocessor : preprocessors) {
            this.preprocessors.put(preprocessor.type(), preprocessor);
        }
        this.candidateDetector = candidateDetector;
        this.rowClusterer = rowClusterer;
        this.answerResolver = answerResolver;
        this.evaluator = evaluator;
        this.imageLoader = imageLoader;
        this.overlayRenderer = overlayRenderer;
        this.observer = observer;
    }

    /** Wires a detector with the pure-Java preprocessor, for use outside a Spring context. */
    public static OmrDetector create(OmrProperties properties, PipelineObserver observer) {
        return new OmrDetector(properties,
                List.of(new JavaPreprocessor()),
                new BubbleCandidateDetector(),
                new RowClusterer(),
                new AnswerResolver(new FillClassifier()),
                new Evaluator(),
                new SheetImageLoader(),
                new DebugOverlayRenderer(),
                observer);
    }

    public OmrProperties properties() {
        return properties;
    }

    public DetectionResult detect(BufferedImage image) {
        return detect(image, properties.expectedOptions(), properties);
    }

    public DetectionResult detect(BufferedImage image, int expectedOptions) {
        return detect(image, expectedOptions, properties);
    }

    public DetectionResult detect(BufferedImage image, OmrProperties settings) {
        return detect(image, settings.expectedOptions(), settings);
    }

    public DetectionResult detect(BufferedImage image, int expectedOptions, OmrProperties settings) {
        Tracker tracker = new Tracker();
        try {
            Preprocessor.requireImage(image);
            tracker.reached(PipelineStage.LOADED, describe(image));
            return resolve(image, expectedOptions, settings, tracker);
        } catch (OmrException | IllegalArgumentException e) {
            return fail(tracker, e, DetectionResult.error(e.getMessage()));
        }
    }

    public DetectionResult detect(Path imageFile) {
        return detect(imageFile, properties.expectedOptions());
    }

    public DetectionResult detect(Path imageFile, int expectedOptions) {
        Tracker tracker = new Tracker();
        try {
            BufferedImage image = imageLoader.load(imageFile);
            tracker.reached(PipelineStage.LOADED, imageFile.getFileName() + " " + describe(image));
            return resolve(image, expectedOptions, properties, tracker);
        } catch (OmrException | IllegalArgumentException e) {
            return fail(tracker, e, DetectionResult.error(e.getMessage()));
        }
    }

    public EvaluationResult evaluate(BufferedImage image, AnswerKey answerKey) {
        return evaluate(image, answerKey, properties.expectedOptions(), properties);
    }

    public EvaluationResult evaluate(BufferedImage image, AnswerKey answerKey, int expectedOptions) {
        return evaluate(image, answerKey, expectedOptions, properties);
    }

    public EvaluationResult evaluate(BufferedImage image, AnswerKey answerKey, int expectedOptions,
                                     OmrProperties settings) {
        Tracker tracker = new Tracker();
        try {
            requireKey(answerKey);
            Preprocessor.requireImage(image);
            tracker.reached(PipelineStage.LOADED, describe(image));
            return score(resolve(image, expectedOptions, settings, tracker), answerKey, tracker);
        } catch (OmrException | IllegalArgumentException e) {
            return fail(tracker, e, EvaluationResult.error(e.getMessage()));
        }
    }

    public EvaluationResult evaluate(Path imageFile, AnswerKey answerKey) {
        return evaluate(imageFile, answerKey, properties.expectedOptions());
    }

    public EvaluationResult evaluate(Path imageFile, AnswerKey answerKey, int expectedOptions) {
        Tracker tracker = new Tracker();
        try {
            requireKey(answerKey);
            BufferedImage image = imageLoader.load(imageFile);
            tracker.reached(PipelineStage.LOADED, imageFile.getFileName() + " " + describe(image));
            return score(resolve(image, expectedOptions, properties, tracker), answerKey, tracker);
        } catch (OmrException | IllegalArgumentException e) {
            return fail(tracker, e, EvaluationResult.error(e.getMessage()));
        }
    }

    public byte[] annotate(BufferedImage image) {
        return annotate(image, properties.expectedOptions());
    }

    /**
     * Runs detection and returns a PNG of the sheet with every accepted
     * bubble highlighted. Unlike the other entry points this one throws
     * {@link OmrException} on failure.
     */
    public byte[] annotate(BufferedImage image, int expectedOptions) {
        Preprocessor.requireImage(image);
        Tracker tracker = new Tracker();
        tracker.reached(PipelineStage.LOADED, describe(image));
        Analysis analysis = analyse(image, expectedOptions, properties, tracker);
        return overlayRenderer.render(image, analysis.rows(), analysis.results());
    }

    private DetectionResult resolve(BufferedImage image, int expectedOptions, OmrProperties settings, Tracker tracker) {
        Analysis analysis = analyse(image, expectedOptions, settings, tracker);
        DetectionResult result = answerResolver.resolve(analysis.results(), settings.debug());
        tracker.reached(PipelineStage.RESOLVED, result.totalQuestions() + " questions");

        if (result.totalQuestions() == 0) {
            log.warn("No complete rows of {} bubbles found on {}", expectedOptions, describe(image));
        } else {
            log.info("Detected {} questions on {}", result.totalQuestions(), describe(image));
        }
        return result;
    }

    private Analysis analyse(BufferedImage image, int expectedOptions, OmrProperties settings, Tracker tracker) {
        if (expectedOptions < 1 || expectedOptions > 26) {
            throw new IllegalArgumentException("expectedOptions must be within [1, 26], got " + expectedOptions);
        }

        Preprocessor preprocessor = preprocessors.get(settings.preprocessor());
        if (preprocessor == null) {
            throw new IllegalArgumentException("No preprocessor registered for " + settings.preprocessor());
        }

        BinaryMask mask = preprocessor.preprocess(image, settings);
        tracker.reached(PipelineStage.PREPROCESSED, mask.darkCount() + " dark pixels");

        List<BubbleCandidate> candidates = candidateDetector.findCandidates(
                mask, settings.bubbleAreaRange(), settings.aspectRatioRange());
        tracker.reached(PipelineStage.CANDIDATES_FOUND, candidates.size() + " candidates");

        List<Row> rows = rowClusterer.clusterRows(candidates, settings.rowThreshold(), expectedOptions);
        tracker.reached(PipelineStage.ROWS_CLUSTERED, rows.size() + " rows");

        List<QuestionResult> results = answerResolver.classifyAll(rows, mask, settings.fillThreshold());
        tracker.reached(PipelineStage.CLASSIFIED, results.size() + " questions");

        return new Analysis(rows, results);
    }

    private EvaluationResult score(DetectionResult detection, AnswerKey answerKey, Tracker tracker) {
        EvaluationResult result = evaluator.evaluate(detection, answerKey);
        tracker.reached(PipelineStage.EVALUATED, result.score() + "/" + result.total());
        log.info("Score {}/{} ({}%)", result.score(), result.total(), result.percentage());
        return result;
    }

    private static void requireKey(AnswerKey answerKey) {
        if (answerKey == null || answerKey.size() == 0) {
            throw new EmptyAnswerKeyException();
        }
    }

    private <T> T fail(Tracker tracker, Exception e, T errorResult) {
        observer.pipelineFailed(tracker.last, e);
        return errorResult;
    }

    private static String describe(BufferedImage image) {
        return image == null ? "<no image>" : image.getWidth() + "x" + image.getHeight();
    }

    private record Analysis(List<Row> rows, List<QuestionResult> results) {}

    /** Last stage reached by one call. */
    private final class Tracker {
        private PipelineStage last;

        void reached(PipelineStage stage, String detail) {
            last = stage;
            observer.stageCompleted(stage, detail);
        }
    }
}
