package stela.elab;

import java.util.List;
import stela.backend.FunctionBuilder;
import stela.backend.Statement;

/**
 * Result of elaborating a function block.
 * @param function the backend function the inputs were declared on
 * @param argNames argument names in declaration order, without {@code self}
 * @param statements the top-level statements in program order
 */
public record ElaboratedFunction(FunctionBuilder function, List<String> argNames, List<Statement> statements) {
  public ElaboratedFunction {
    argNames = List.copyOf(argNames);
    statements = List.copyOf(statements);
  }
}
