/**
 * Rule evaluation: lifecycle events in, candidates out.
 */
package io.automation.evaluate;
