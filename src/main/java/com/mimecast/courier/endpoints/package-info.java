/**
 * Embedded HTTP endpoints.
 */
package com.mimecast.courier.endpoints;
