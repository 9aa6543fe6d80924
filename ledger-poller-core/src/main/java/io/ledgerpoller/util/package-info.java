/**
 * Internal helpers: daemon thread naming and a dependency-free JSON codec for flat objects.
 */
package io.ledgerpoller.util;
