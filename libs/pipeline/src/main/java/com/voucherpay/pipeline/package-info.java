/**
 * Framework-neutral middleware pipeline: accessibility context extraction before the handler,
 * response enrichment and analytics derivation after it.
 */
package com.voucherpay.pipeline;
