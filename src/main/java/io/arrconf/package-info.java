/**
 * arrconf source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.arrconf.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.arrconf.cli.ArrconfCommand} maps the run, daemon and test-config modes to the runtime.</li>
 *   <li>{@code io.arrconf.runtime.RunPipeline} executes one staged reconciliation pass.</li>
 *   <li>{@code io.arrconf.runtime.Daemon} schedules repeated runs.</li>
 *   <li>{@code io.arrconf.reconcile.AttributeDiffer} turns attribute mappings into diffs and payloads.</li>
 * </ul>
 */
package io.arrconf;
