/**
 * Request-scoped observability: correlation context with an SLF4J MDC bridge, log-field
 * redaction and Micrometer meter creation shared by the pipeline and the API service.
 */
package com.voucherpay.observability;
