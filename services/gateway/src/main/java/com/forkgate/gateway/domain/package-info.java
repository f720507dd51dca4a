/**
 * Admission and metering of execution requests.
 *
 * <p>{@link com.forkgate.gateway.domain.AdmissionGateway} is the only place a run is started: it
 * picks the budget for an already resolved tier, invokes the engine once and records the run in the
 * usage ledger. Nothing in this package knows about HTTP.
 */
package com.forkgate.gateway.domain;
