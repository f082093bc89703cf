/**
 * HiveMesh: task, brainstorm, result and status messaging for agent fleets over RabbitMQ, with
 * an in-process voting engine that settles collaborative decisions.
 */
package io.hivemesh;
