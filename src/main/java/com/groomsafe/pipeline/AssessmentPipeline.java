package com.groomsafe.pipeline;

import com.groomsafe.config.Config;
import com.groomsafe.core.PipelineTelemetry;
import com.groomsafe.core.ValidationException;
import com.groomsafe.explain.AuditReportRenderer;
import com.groomsafe.explain.Explanation;
import com.groomsafe.explain.ExplanationBuilder;
import com.groomsafe.features.FeatureExtractor;
import com.groomsafe.json.AssessmentJsonWriter;
import com.groomsafe.json.ConversationJsonReader;
import com.groomsafe.model.BehavioralFeatures;
import com.groomsafe.model.Conversation;
import com.groomsafe.model.RiskAssessment;
import com.groomsafe.progression.ProgressionClassifier;
import com.groomsafe.scoring.RiskSynthesizer;
import com.groomsafe.scoring.ScoringProfile;
import com.groomsafe.shield.ExposureGuard;
import com.groomsafe.shield.ExposureLevel;
import com.groomsafe.shield.ExposureLimits;
import com.groomsafe.shield.SafeSummary;
import com.groomsafe.shield.SafeSummaryBuilder;
import com.groomsafe.shield.VisualizationData;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;

/**
 * Wires extraction, scoring, explanation and the analyst shield for callers that want
 * the whole result in one call. Stateless apart from the shared {@link ExposureGuard}.
 */
public final class AssessmentPipeline {
    private static final Logger LOG = LogManager.getLogger(AssessmentPipeline.class);

    private final FeatureExtractor extractor;
    private final RiskSynthesizer synthesizer;
    private final ExplanationBuilder explanations;
    private final AuditReportRenderer reports;
    private final SafeSummaryBuilder summaries;
    private final ExposureGuard guard;
    private final ConversationJsonReader reader;
    private final AssessmentJsonWriter writer;

    /**
     * Uses the layered configuration of the current working directory.
     */
    public AssessmentPipeline() {
        this(Config.load(Path.of("").toAbsolutePath()));
    }

    public AssessmentPipeline(Config config) {
        this(config, Clock.systemUTC());
    }

    public AssessmentPipeline(Config config, Clock clock) {
        Config cfg = config == null ? Config.defaults() : config;
        Clock c = clock == null ? Clock.systemUTC() : clock;
        Config.ResolvedValue zone = cfg.resolve("features.zone");
        LOG.debug("pipeline config: features.zone={} source={}", zone.value, zone.source);
        FeatureExtractor featureExtractor = new FeatureExtractor(cfg);
        this.extractor = featureExtractor;
        this.synthesizer = new RiskSynthesizer(
                featureExtractor,
                new ProgressionClassifier(cfg),
                ScoringProfile.fromConfig(cfg),
                cfg,
                c
        );
        this.explanations = new ExplanationBuilder();
        this.reports = new AuditReportRenderer();
        this.summaries = new SafeSummaryBuilder(cfg);
        this.guard = new ExposureGuard(ExposureLimits.fromConfig(cfg), c);
        this.reader = new ConversationJsonReader();
        this.writer = new AssessmentJsonWriter();
    }

    public ExposureGuard exposureGuard() {
        return guard;
    }

    public PipelineResult run(Conversation conversation) {
        return run(conversation, null);
    }

    /**
     * Runs the full assessment. A safe summary is built only when {@code exposureLevel}
     * is non-null.
     */
    public PipelineResult run(Conversation conversation, ExposureLevel exposureLevel) {
        requireConversation(conversation);
        PipelineTelemetry telemetry = new PipelineTelemetry(conversation.id, Instant.now());

        telemetry.startStep(PipelineTelemetry.STEP_EXTRACT);
        BehavioralFeatures features = extractor.extract(conversation);
        telemetry.endStep(PipelineTelemetry.STEP_EXTRACT, conversation.messageCount(), 0);

        telemetry.startStep(PipelineTelemetry.STEP_SCORE);
        RiskAssessment assessment = synthesizer.assess(conversation, features);
        telemetry.endStep(PipelineTelemetry.STEP_SCORE, 1, 0);

        telemetry.startStep(PipelineTelemetry.STEP_EXPLAIN);
        Explanation explanation = explanations.explain(assessment, features, conversation);
        telemetry.endStep(PipelineTelemetry.STEP_EXPLAIN, 1, 0);

        telemetry.startStep(PipelineTelemetry.STEP_REPORT);
        String report = reports.render(explanation, assessment);
        SafeSummary summary = exposureLevel == null
                ? null
                : summaries.createSafeSummary(conversation, assessment, features, exposureLevel);
        telemetry.endStep(PipelineTelemetry.STEP_REPORT, summary == null ? 1 : 2, 0);
        telemetry.finish();

        LOG.info("assessment done: assessment={} conversation={} score={} level={} stage={} review={} {}",
                assessment.assessmentId,
                assessment.conversationId,
                String.format(Locale.US, "%.1f", assessment.score),
                assessment.riskLevel.wireName(),
                assessment.stage.wireName(),
                assessment.requiresHumanReview,
                telemetry.summaryLine());

        return new PipelineResult(conversation, features, assessment, explanation, report, summary,
                telemetry.stepRecords());
    }

    public VisualizationData visualization(PipelineResult result) {
        return summaries.visualizationData(result.conversation, result.features, result.assessment);
    }

    /**
     * JSON in, JSON out: parses a conversation, runs it and renders assessment,
     * features and explanation under one object.
     */
    public JSONObject runJson(String conversationJson, String exposureLevel) {
        Conversation conversation = reader.read(conversationJson);
        ExposureLevel level = exposureLevel == null ? null : ExposureLevel.fromWireOrMinimal(exposureLevel);
        PipelineResult result = run(conversation, level);

        JSONObject root = new JSONObject();
        root.put("assessment", writer.assessment(result.assessment));
        root.put("features", writer.features(result.features));
        root.put("explanation", writer.explanation(result.explanation));
        if (result.hasSafeSummary()) {
            root.put("safe_summary", writer.safeSummary(result.safeSummary));
        }
        return root;
    }

    private static void requireConversation(Conversation conversation) {
        if (conversation == null) {
            throw new ValidationException("conversation is required");
        }
    }
}
