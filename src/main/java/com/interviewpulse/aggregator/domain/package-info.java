/**
 * Immutable domain model of the aggregation pipeline.
 *
 * <p>{@link com.interviewpulse.aggregator.domain.RawInsight} records flow in from upstream
 * analyzers; {@link com.interviewpulse.aggregator.domain.InsightBatch} results flow out to
 * delivery. All records serialize as snake_case JSON.
 */
package com.interviewpulse.aggregator.domain;
