/**
 * AuthRelay source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.authrelay.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.authrelay.cli.AuthRelayCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.authrelay.runtime.AuthRelayRuntime} deploys chains and contracts and drives the relayer.</li>
 *   <li>{@code io.authrelay.registry.AuthorizationRegistry} and {@code io.authrelay.processor.Processor} hold the access-control and execution logic.</li>
 * </ul>
 */
package io.authrelay;
