package stela.backend;

/**
 * Named debug metadata of a statement.
 * @param value literal text, or the signal name if isVar
 * @param isVar whether the value names a hardware signal
 */
public record ScopeVariable(String value, boolean isVar) {}
