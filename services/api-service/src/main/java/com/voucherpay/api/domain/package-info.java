/**
 * Ports to the systems the API depends on but does not own: the user store, password
 * hashing and outbound notification.
 */
package com.voucherpay.api.domain;
