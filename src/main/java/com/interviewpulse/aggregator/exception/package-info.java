/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.interviewpulse.aggregator.exception.InsightAggregatorException} - Base exception</li>
 *   <li>{@link com.interviewpulse.aggregator.exception.MalformedInsightException} - Raw insight rejected
 *       at ingest (dropped from feeds, HTTP 400 on the REST path)</li>
 *   <li>{@link com.interviewpulse.aggregator.exception.DeliveryException} - Batch could not be published;
 *       aborts only the affected session's tick</li>
 * </ul>
 *
 * <p>Configuration errors are reported as {@link java.lang.IllegalArgumentException} from the
 * properties classes and validators so the application fails to start.
 *
 * @see com.interviewpulse.aggregator.presentation.exception.GlobalExceptionHandler
 */
package com.interviewpulse.aggregator.exception;
