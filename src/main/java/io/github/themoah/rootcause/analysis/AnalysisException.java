package io.github.themoah.rootcause.analysis;

/**
 * Raised when an analysis cannot complete for reasons outside its input,
 * such as a closed analyzer or an interrupted or failed scoring worker.
 */
public class AnalysisException extends RuntimeException {

  public AnalysisException(String message) {
    super(message);
  }

  public AnalysisException(String message, Throwable cause) {
    super(message, cause);
  }
}
