package com.interviewpulse.aggregator.service.delivery;

import com.interviewpulse.aggregator.domain.InsightBatch;
import com.interviewpulse.aggregator.exception.DeliveryException;

/**
 * Hands aggregated batches to the real-time delivery transport.
 */
public interface BatchPublisher {

    /**
     * @throws DeliveryException when the transport rejects or cannot take the batch
     */
    void publishBatch(String sessionId, InsightBatch batch);
}
