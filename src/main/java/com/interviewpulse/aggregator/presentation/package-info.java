/**
 * Presentation layer (REST API controllers, DTOs and exception handling).
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - REST endpoints under {@code /insights}</li>
 *   <li>{@code presentation.dto} - request/response records (snake_case JSON)</li>
 *   <li>{@code presentation.exception} - Global exception handling for HTTP responses</li>
 * </ul>
 *
 * <p>Controllers are thin adapters over the aggregation engine; they never throw HTTP-specific
 * exceptions.
 *
 * @see com.interviewpulse.aggregator.presentation.exception.GlobalExceptionHandler
 */
package com.interviewpulse.aggregator.presentation;
