/**
 * Runtime orchestration package.
 *
 * <p>{@link io.arrconf.runtime.RunPipeline} owns one staged reconciliation pass over every
 * active instance. {@link io.arrconf.runtime.Daemon} repeats that pass on the configured
 * weekly schedule and on configuration reloads.
 */
package io.arrconf.runtime;
