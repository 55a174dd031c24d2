package com.interviewpulse.aggregator.presentation.controller;

import com.interviewpulse.aggregator.domain.InsightBatch;
import com.interviewpulse.aggregator.domain.OverallAssessment;
import com.interviewpulse.aggregator.domain.RawInsight;
import com.interviewpulse.aggregator.presentation.dto.BufferStatusResponse;
import com.interviewpulse.aggregator.presentation.dto.ClearResponse;
import com.interviewpulse.aggregator.presentation.dto.InsightRequest;
import com.interviewpulse.aggregator.presentation.dto.ReceiveResponse;
import com.interviewpulse.aggregator.service.aggregation.AggregationEngine;
import com.interviewpulse.aggregator.service.recommendation.AssessmentGenerator;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;

/**
 * HTTP surface of the aggregator: direct ingest, on-demand aggregation, assessment and session
 * lifecycle. Thin adapter over {@link AggregationEngine}.
 */
@RestController
@RequestMapping("/insights")
class InsightController {

    private static final Logger LOG = LogManager.getLogger(InsightController.class);

    private final AggregationEngine engine;
    private final AssessmentGenerator assessments;
    private final Clock clock;

    InsightController(AggregationEngine engine, AssessmentGenerator assessments, Clock clock) {
        this.engine = engine;
        this.assessments = assessments;
        this.clock = clock;
    }

    @PostMapping("/receive")
    ResponseEntity<ReceiveResponse> receive(@Valid @RequestBody InsightRequest request) {
        RawInsight insight = request.toRawInsight();
        int size = engine.addInsight(insight);
        LOG.debug("Received {}/{} for session {}", insight.source(), insight.type(), insight.sessionId());
        return ResponseEntity.ok(ReceiveResponse.received(insight.sessionId(), size));
    }

    /** Aggregates now without clearing the buffer. */
    @GetMapping("/{sessionId}/aggregate")
    ResponseEntity<InsightBatch> aggregate(@PathVariable String sessionId) {
        return ResponseEntity.ok(engine.aggregate(sessionId));
    }

    @GetMapping("/{sessionId}/assessment")
    ResponseEntity<OverallAssessment> assessment(@PathVariable String sessionId,
                                                 @RequestParam(name = "duration_minutes", defaultValue = "30")
                                                 int durationMinutes) {
        InsightBatch batch = engine.aggregate(sessionId);
        return ResponseEntity.ok(assessments.assess(batch, durationMinutes));
    }

    /** Round ended or was cancelled. */
    @DeleteMapping("/{sessionId}/clear")
    ResponseEntity<ClearResponse> clear(@PathVariable String sessionId) {
        int discarded = engine.clearSession(sessionId);
        return ResponseEntity.ok(ClearResponse.cleared(sessionId, discarded));
    }

    @GetMapping("/{sessionId}/buffer-status")
    ResponseEntity<BufferStatusResponse> bufferStatus(@PathVariable String sessionId) {
        return ResponseEntity.ok(new BufferStatusResponse(sessionId, engine.bufferSize(sessionId), clock.instant()));
    }
}
