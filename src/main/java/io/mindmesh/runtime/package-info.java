/**
 * Node wiring.
 *
 * <p>{@link io.mindmesh.runtime.MeshNode} owns the RPC method table and the background loops:
 * state replication, fault recovery audits, task dispatch and self-registration with a
 * coordinator.
 */
package io.mindmesh.runtime;
