/**
 * Rule and campaign definition sources.
 */
package io.automation.rules;
