/**
 * Per-filter duplicate suppression.
 *
 * <p>{@link io.ledgerpoller.cursor.CursorStore} keeps, for every filter, a watermark of the
 * newest delivered event time and a bounded map of recently delivered event ids. State lives
 * in memory only and is lost on restart.
 */
package io.ledgerpoller.cursor;
