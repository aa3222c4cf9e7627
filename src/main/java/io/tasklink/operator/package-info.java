/**
 * Operator service.
 *
 * <p>{@link io.tasklink.operator.OperatorSupervisor} accepts connections on
 * the operator socket, names them, forwards every server log record to
 * them and handles their requests: renaming, queueing tasks and listing
 * recently seen implants.
 */
package io.tasklink.operator;
