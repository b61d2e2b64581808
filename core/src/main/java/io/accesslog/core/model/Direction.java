package io.accesslog.core.model;

/**
 * Which half of an exchange a directive reads from.
 *
 * <ul>
 *   <li>{@link #REQUEST}: the inbound request ({@code %{NAME}i}, {@code %{NAME}xi}).
 *   <li>{@link #RESPONSE}: the outbound response ({@code %{NAME}o}, {@code %{NAME}xo}).
 * </ul>
 */
public enum Direction {
    REQUEST,
    RESPONSE
}
