package com.fleet.anomaly.engine.evaluators;

import com.fleet.anomaly.engine.EvaluationContext;
import com.fleet.anomaly.engine.RuleEvaluator;
import com.fleet.anomaly.model.RuleFamily;
import com.fleet.anomaly.model.RuleFinding;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies the rules of the vehicle's current geography to the incoming message.
 * Runs on every message, whether or not a previous snapshot exists.
 */
@Component
public class GeographyContextEvaluator implements RuleEvaluator {

    @Override
    public RuleFamily getFamily() {
        return RuleFamily.GEOGRAPHY;
    }

    @Override
    public List<RuleFinding> evaluate(EvaluationContext context) {
        if (context.getGeography() == null) {
            return List.of();
        }

        List<RuleFinding> findings = new ArrayList<>();
        for (GeographyRule rule : GeographyRuleTable.rulesFor(context.getGeography(), context.getMessageType())) {
            rule.check(context.getCurrent()).ifPresent(findings::add);
        }
        return findings;
    }
}
