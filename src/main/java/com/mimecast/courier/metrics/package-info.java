/**
 * Micrometer metrics exposed in Prometheus format on the webhook endpoint.
 */
package com.mimecast.courier.metrics;
