/**
 * Configuration loading and object-graph wiring for the {@code watch} command.
 * <p><strong>Role:</strong> Translates defaults, YAML ({@code common} + {@code watch} sections), and
 * {@code key=value} CLI arguments into a validated {@link dev.chatpulse.config.MonitorConfig}, then builds
 * the pipeline in {@link dev.chatpulse.config.CompositionRoot}.</p>
 * <p><strong>Concurrency:</strong> Used from the CLI thread only.</p>
 */
package dev.chatpulse.config;
