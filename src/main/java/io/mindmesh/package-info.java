/**
 * MindMesh source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.mindmesh.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.mindmesh.cli.MeshCommand} maps commands to RPC calls against a node.</li>
 *   <li>{@code io.mindmesh.runtime.MeshNode} wires the listener, registry, balancer, state and recovery loops.</li>
 *   <li>{@code io.mindmesh.rpc.RpcServer} and {@code io.mindmesh.rpc.RpcClient} speak the framed wire protocol.</li>
 * </ul>
 */
package io.mindmesh;
