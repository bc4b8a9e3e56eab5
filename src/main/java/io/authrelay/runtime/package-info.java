/**
 * Runtime orchestration package.
 *
 * <p>{@link io.authrelay.runtime.AuthRelayRuntime} owns cross-cutting behavior:
 * chain bootstrapping, contract deployment, bridge relaying, persistence and the
 * audit trail used by the CLI.
 */
package io.authrelay.runtime;
