/**
 * Bookkeeping core for the batch detection pipeline.
 *
 * <p>Package contents:
 *
 * <ul>
 *   <li>{@link com.example.detectionledger.core.credentials} – short-lived database tokens, their
 *       renewal, and static credentials held in AWS Secrets Manager.
 *   <li>{@link com.example.detectionledger.core.jdbc} – the pooled {@code SessionManager} and its
 *       transactional unit of work.
 *   <li>{@link com.example.detectionledger.core.detection} – model output as it is recorded.
 *   <li>{@link com.example.detectionledger.core.store} – image claim/complete state and detection
 *       rows.
 *   <li>{@link com.example.detectionledger.core.audit} – per-run success/failure records.
 *   <li>{@link com.example.detectionledger.core.pipeline} – the claim, infer, record, complete
 *       loop.
 *   <li>{@link com.example.detectionledger.core.config} – settings read from system properties and
 *       environment variables.
 * </ul>
 *
 * <p>All failures extend {@link com.example.detectionledger.core.LedgerException}.
 */
package com.example.detectionledger.core;
