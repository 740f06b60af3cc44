package stela.backend;

import java.util.List;
import java.util.Map;

/**
 * A backend-owned hardware statement.
 * Its semantic content is fixed at construction; only debug metadata can be attached afterwards.
 */
public interface Statement {
  void addFileLine(String filename, int line);
  List<SourceLocation> getFileLines();

  /**
   * Attaches a named debug variable. A later value for the same name replaces the earlier one.
   * @param name the host-level name
   * @param value literal text or signal name
   * @param isVar true iff value names a signal
   */
  void addScopeVariable(String name, String value, boolean isVar);
  Map<String, ScopeVariable> getScopeVariables();
}
