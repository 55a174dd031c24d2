/**
 * Stream ingest: feed abstraction, Redis stream implementation, message decoding and the
 * long-running ingest loop.
 */
package com.interviewpulse.aggregator.service.ingest;
