package stela.elab;

/**
 * Type of a function block argument.
 * @param width bit width
 * @param signed signedness
 */
public record PortType(int width, boolean signed) {}
