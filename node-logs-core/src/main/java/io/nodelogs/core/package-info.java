/**
 * Protocol-centric core for node log access.
 *
 * <p>This module is deliberately transport-neutral. It contains only:
 * <ul>
 *   <li>Protocol constants, node request targets and configuration</li>
 *   <li>Decoders for the list, snippet and chunk responses a node emits</li>
 *   <li>Immutable view models and size formatting</li>
 * </ul>
 *
 * <p>The request channel, the seekable reader and HTTP bindings live in other modules.
 */
package io.nodelogs.core;
