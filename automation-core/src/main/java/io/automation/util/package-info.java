/**
 * Internal helpers: thread factory, id generation and connection scoping.
 */
package io.automation.util;
