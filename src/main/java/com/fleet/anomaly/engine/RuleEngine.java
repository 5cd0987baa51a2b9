package com.fleet.anomaly.engine;

import com.fleet.anomaly.config.DetectionConfig;
import com.fleet.anomaly.model.Anomaly;
import com.fleet.anomaly.model.RuleFamily;
import com.fleet.anomaly.model.RuleFinding;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Runs every registered rule family against a message and turns the findings into anomalies.
 * Uses the Strategy pattern: each RuleFamily is handled by one registered RuleEvaluator.
 */
@Component
public class RuleEngine {

    private static final Logger log = LoggerFactory.getLogger(RuleEngine.class);

    private final Map<RuleFamily, RuleEvaluator> evaluatorMap;
    private final Tracer tracer;
    private final DetectionConfig config;

    public RuleEngine(List<RuleEvaluator> evaluators, Tracer tracer, DetectionConfig config) {
        this.evaluatorMap = new EnumMap<>(RuleFamily.class);
        this.tracer = tracer;
        this.config = config;

        for (RuleEvaluator evaluator : evaluators) {
            evaluatorMap.put(evaluator.getFamily(), evaluator);
            log.info("Registered rule evaluator: {} -> {}",
                    evaluator.getFamily(), evaluator.getClass().getSimpleName());
        }
    }

    /**
     * Evaluate all rule families for one message. The temporal family only runs when the
     * context carries a previous snapshot.
     *
     * @param context    the message under evaluation
     * @param detectedAt timestamp stamped on every produced anomaly
     * @return anomalies to forward, in family order
     */
    public List<Anomaly> evaluateAll(EvaluationContext context, long detectedAt) {
        List<Anomaly> anomalies = new ArrayList<>();

        for (RuleEvaluator evaluator : evaluatorMap.values()) {
            if (evaluator.getFamily() == RuleFamily.TEMPORAL && !context.hasPrevious()) {
                continue;
            }

            Span span = tracer.nextSpan()
                    .name("rules.evaluate." + evaluator.getFamily())
                    .tag("vehicle.id", context.getVehicleId())
                    .tag("message.type", context.getMessageType().getWireName())
                    .start();

            try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
                List<RuleFinding> findings = evaluator.evaluate(context);
                span.tag("rules.triggered", String.valueOf(findings.size()));

                for (RuleFinding finding : findings) {
                    if (finding.getAnomalyType().isDiagnostic() && !config.getRules().isForwardDiagnostics()) {
                        log.info("Diagnostic {} for vehicle {} ({}): {}",
                                finding.getAnomalyType().getTag(), context.getVehicleId(),
                                context.getMessageType().getWireName(), finding.getDetail());
                        continue;
                    }
                    anomalies.add(toAnomaly(context, finding, detectedAt));
                }
            } catch (Exception e) {
                span.error(e);
                log.error("Error evaluating {} rules for vehicle {}: {}",
                        evaluator.getFamily(), context.getVehicleId(), e.getMessage(), e);
                // one broken family must not hide the others
            } finally {
                span.end();
            }
        }

        return anomalies;
    }

    private Anomaly toAnomaly(EvaluationContext context, RuleFinding finding, long detectedAt) {
        return Anomaly.builder()
                .vehicleId(context.getVehicleId())
                .anomalyType(finding.getAnomalyType())
                .messageType(context.getMessageType())
                .geography(context.getGeography())
                .severity(finding.getSeverity())
                .signals(context.getCurrent())
                .detail(finding.getDetail())
                .detectedAt(detectedAt)
                .build();
    }
}
