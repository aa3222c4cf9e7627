/**
 * TaskLink source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.tasklink.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.tasklink.server.TaskLinkServer} wires logging, state and the operator service.</li>
 *   <li>{@code io.tasklink.operator.OperatorSupervisor} owns operator connections.</li>
 *   <li>{@code io.tasklink.estream.EventStream} is the wire protocol shared by server and client.</li>
 * </ul>
 */
package io.tasklink;
