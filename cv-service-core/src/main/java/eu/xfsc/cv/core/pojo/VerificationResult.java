package eu.xfsc.cv.core.pojo;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of a credential verification: the gathered parameters, the named checks
 * that were evaluated and the failures captured on the way.
 *
 * <p>A check that was never reached is absent from {@link #getChecks()}, which is distinct
 * from a check that failed. {@link #isVerified()} is derived from the checks only.</p>
 */
public class VerificationResult {

  private final VerificationParams params = new VerificationParams();
  private final Map<VerificationCheck, Boolean> checks = new EnumMap<>(VerificationCheck.class);
  private final Map<VerificationStage, Exception> errors = new EnumMap<>(VerificationStage.class);

  public VerificationParams getParams() {
    return params;
  }

  public void setCheck(VerificationCheck check, boolean passed) {
    checks.put(check, passed);
  }

  public Optional<Boolean> getCheck(VerificationCheck check) {
    return Optional.ofNullable(checks.get(check));
  }

  public Map<VerificationCheck, Boolean> getChecks() {
    return Collections.unmodifiableMap(checks);
  }

  public void addError(VerificationStage stage, Exception error) {
    errors.put(stage, error);
  }

  public Optional<Exception> getError(VerificationStage stage) {
    return Optional.ofNullable(errors.get(stage));
  }

  public Map<VerificationStage, Exception> getErrors() {
    return Collections.unmodifiableMap(errors);
  }

  /**
   * The credential is verified when it is signed and no evaluated check failed.
   *
   * @return the overall verification flag
   */
  public boolean isVerified() {
    if (!Boolean.TRUE.equals(checks.get(VerificationCheck.SIGNED))) {
      return false;
    }
    return checks.values().stream().allMatch(Boolean::booleanValue);
  }

  /**
   * Checks keyed by their reported names, in evaluation order, followed by {@code verified}.
   *
   * @return the report view of the checks
   */
  public Map<String, Boolean> getTests() {
    Map<String, Boolean> tests = new LinkedHashMap<>();
    checks.forEach((check, passed) -> tests.put(check.getKey(), passed));
    tests.put("verified", isVerified());
    return tests;
  }

  @Override
  public String toString() {
    return "VerificationResult[verified=" + isVerified() + ", checks=" + checks + ", errors=" + errors.keySet() + "]";
  }
}
