/**
 * Engine orchestration package.
 *
 * <p>{@link io.sessionvault.runtime.CrossSessionPersistenceEngine} owns one session's
 * lifecycle: validation and conflict handling on save, repair and migration on load,
 * checkpoint timers, peer crash recovery, and statistics used by the CLI.
 */
package io.sessionvault.runtime;
