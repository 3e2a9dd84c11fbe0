/**
 * Clock adapters for {@link dev.chatpulse.application.port.ClockPort}.
 */
package dev.chatpulse.infrastructure.time;
