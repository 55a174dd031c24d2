/**
 * Aggregation core: grouping raw insights by (category, type), scoring each group, and the
 * engine that orders, truncates, gates and summarizes the result into an
 * {@link com.interviewpulse.aggregator.domain.InsightBatch}.
 */
package com.interviewpulse.aggregator.service.aggregation;
