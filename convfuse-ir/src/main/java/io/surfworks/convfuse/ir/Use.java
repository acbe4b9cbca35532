package io.surfworks.convfuse.ir;

/**
 * One use of a value: the consuming node and the input slot it occupies.
 *
 * @param user   the consuming node
 * @param offset the input index within {@code user}
 */
public record Use(Node user, int offset) {}
