package com.fleet.anomaly.engine;

import com.fleet.anomaly.model.Geography;
import com.fleet.anomaly.model.MessageType;
import com.fleet.anomaly.model.SignalSnapshot;
import lombok.Builder;
import lombok.Data;

/**
 * Everything a rule evaluator may look at for one incoming message.
 */
@Data
@Builder
public class EvaluationContext {

    private String vehicleId;

    private MessageType messageType;

    // Geography reported with this message; selects the geography rule branch.
    private Geography geography;

    private SignalSnapshot current;

    // Previous snapshot of the same message type, null on the vehicle's first sample of it.
    private SignalSnapshot previous;

    public boolean hasPrevious() {
        return previous != null;
    }
}
