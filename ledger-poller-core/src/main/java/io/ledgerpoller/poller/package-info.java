/**
 * The polling engine.
 *
 * <p>{@link io.ledgerpoller.poller.EventPoller} runs two independent schedules: a fetch cycle
 * every configured interval that queries all filters concurrently and delivers new events as
 * one time-ordered batch, and an eviction cycle every five minutes that bounds the
 * duplicate-suppression state.
 *
 * @see io.ledgerpoller.poller.EventPoller
 * @see io.ledgerpoller.poller.EventBatchListener
 * @see io.ledgerpoller.poller.PollerErrorHandler
 */
package io.ledgerpoller.poller;
