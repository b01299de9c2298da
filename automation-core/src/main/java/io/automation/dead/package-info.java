/**
 * Operator tooling for records stuck in DEAD status.
 *
 * @see io.automation.dead.DeadRecordManager
 */
package io.automation.dead;
