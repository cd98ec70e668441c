/**
 * Jakarta Servlet binding for {@link io.nodelogs.server.core.LogHandler}.
 */
package io.nodelogs.servlet;
