package com.fleet.anomaly.engine;

import com.fleet.anomaly.model.RuleFinding;
import com.fleet.anomaly.model.RuleFamily;

import java.util.List;

/**
 * A stateless family of anomaly rules.
 */
public interface RuleEvaluator {

    /**
     * The rule family this evaluator implements.
     */
    RuleFamily getFamily();

    /**
     * Evaluate one message.
     *
     * @param context the message, its vehicle's geography and (for temporal rules) the previous snapshot
     * @return one finding per triggered rule, empty when nothing triggered
     */
    List<RuleFinding> evaluate(EvaluationContext context);
}
