/**
 * TabSense source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.tabsense.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.tabsense.cli.TabSenseCommand} maps commands to hub APIs.</li>
 *   <li>{@code io.tabsense.runtime.IntelligenceHub} owns admission, dispatch, timeouts and insights.</li>
 *   <li>{@code io.tabsense.storage.TaskStore} is the authoritative task table.</li>
 * </ul>
 */
package io.tabsense;
