package com.tidewaysystems.aggregate;

import com.tidewaysystems.TidewayException;

/**
 * Thrown when loading an aggregate whose stream has no events.
 */
public class AggregateNotFoundException extends TidewayException {

    private static final long serialVersionUID = 1L;

    private final String aggregateId;

    public AggregateNotFoundException(String aggregateType, String aggregateId) {
        super(String.format("%s '%s' not found", aggregateType, aggregateId));
        this.aggregateId = aggregateId;
    }

    public String getAggregateId() {
        return aggregateId;
    }
}
