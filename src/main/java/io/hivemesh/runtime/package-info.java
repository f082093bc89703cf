/**
 * Process wiring: config, broker connection, delivery control, voting engine and the task
 * orchestrator that ties them together.
 */
package io.hivemesh.runtime;
