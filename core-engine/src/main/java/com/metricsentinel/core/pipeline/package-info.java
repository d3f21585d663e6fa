/**
 * End-to-end orchestration: detect, fuse, resolve, alert, flush.
 *
 * @since 1.0.0
 */
package com.metricsentinel.core.pipeline;
