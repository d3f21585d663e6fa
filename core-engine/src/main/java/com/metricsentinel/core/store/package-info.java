/**
 * Read contract of the metric store and repositories for the pipeline's
 * persisted state, with in-memory and file-backed implementations.
 *
 * @since 1.0.0
 */
package com.metricsentinel.core.store;
