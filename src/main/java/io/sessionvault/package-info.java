/**
 * SessionVault source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.sessionvault.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.sessionvault.cli.SessionVaultCommand} maps commands to engine operations.</li>
 *   <li>{@code io.sessionvault.runtime.CrossSessionPersistenceEngine} orchestrates saves, loads, checkpoints and crash recovery.</li>
 *   <li>{@code io.sessionvault.storage.TaskFileStore} owns the task and queue files shared by every session.</li>
 * </ul>
 */
package io.sessionvault;
