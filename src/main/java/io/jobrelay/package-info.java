/**
 * JobRelay source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.jobrelay.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.jobrelay.cli.JobRelayCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.jobrelay.runtime.JobRelayRuntime} owns stores, buses and workers for one data root.</li>
 *   <li>{@code io.jobrelay.supervisor.ProcessSupervisor} runs one external process and watches its output.</li>
 * </ul>
 */
package io.jobrelay;
