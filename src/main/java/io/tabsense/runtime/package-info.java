/**
 * Hub orchestration package.
 *
 * <p>{@link io.tabsense.runtime.IntelligenceHub} is the public facade. The dispatcher, execution
 * supervisor, stuck-task reaper, insight generator and notification fan-out are package-private
 * collaborators it owns.
 */
package io.tabsense.runtime;
