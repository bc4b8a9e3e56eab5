/**
 * Deterministic contract host.
 *
 * <p>{@link io.authrelay.host.LocalChain} runs contract entry points inside savepoints,
 * dispatches the messages they return depth-first and routes sub-message results back
 * through {@code reply}. Contract state is typed through {@link io.authrelay.host.Item},
 * {@link io.authrelay.host.StateMap} and {@link io.authrelay.host.StateDeque}.
 */
package io.authrelay.host;
