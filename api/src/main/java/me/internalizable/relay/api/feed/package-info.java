/**
 * Change-feed subscription API.
 *
 * <p>This package exposes the backend-agnostic surface applications use to follow
 * row changes in real time.</p>
 *
 * <h2>Core Interfaces</h2>
 * <ul>
 *   <li>{@link ChangeFeedService} - Main service for subscribing to table changes</li>
 *   <li>{@link Subscription} - Represents a registered handler</li>
 *   <li>{@link ChangeHandler} - Callbacks for inserts, updates, deletes</li>
 *   <li>{@link SubscriptionOptions} - Event selector, filter, debounce</li>
 * </ul>
 *
 * <h2>Channels</h2>
 * <ul>
 *   <li>{@link ChannelKey} - Identity shared by equivalent subscriptions</li>
 *   <li>{@link ChannelStatus} - Channel lifecycle states</li>
 *   <li>{@link FeedStats} - Diagnostic counters</li>
 * </ul>
 *
 * @see me.internalizable.relay.api.event
 * @see me.internalizable.relay.api.table
 */
package me.internalizable.relay.api.feed;
