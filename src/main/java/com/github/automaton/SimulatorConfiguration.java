package com.github.automaton;

/**
 * This class encapsulates all the configuration parameters for the {@link Simulator}. Use the
 * {@code SimulatorConfigurationBuilder} to build it.
 *
 * Notes:<br>
 * 1. validateOnEntry re-runs the validator in the configured validationMode at the start of every
 * simulator operation. Membership of every state and symbol actually touched is re-checked by the
 * transition engine regardless.<br>
 * 2. traceSteps logs every transition taken at debug level. Leave off for long inputs.<br>
 */
public final class SimulatorConfiguration {
  private final ValidationMode validationMode;
  private final boolean validateOnEntry;
  private final boolean traceSteps;

  public static SimulatorConfiguration defaults() {
    return new SimulatorConfiguration(ValidationMode.STRUCTURAL, true, false);
  }

  public ValidationMode getValidationMode() {
    return validationMode;
  }

  public boolean getValidateOnEntry() {
    return validateOnEntry;
  }

  public boolean getTraceSteps() {
    return traceSteps;
  }

  public final static class SimulatorConfigurationBuilder {
    private ValidationMode validationMode = ValidationMode.STRUCTURAL;
    private boolean validateOnEntry = true;
    private boolean traceSteps;

    public static SimulatorConfigurationBuilder newBuilder() {
      return new SimulatorConfigurationBuilder();
    }

    public SimulatorConfigurationBuilder validationMode(final ValidationMode validationMode) {
      this.validationMode = validationMode;
      return this;
    }

    public SimulatorConfigurationBuilder validateOnEntry(final boolean validateOnEntry) {
      this.validateOnEntry = validateOnEntry;
      return this;
    }

    public SimulatorConfigurationBuilder traceSteps(final boolean traceSteps) {
      this.traceSteps = traceSteps;
      return this;
    }

    public SimulatorConfiguration build() throws ValidationException {
      final SimulatorConfiguration config =
          new SimulatorConfiguration(validationMode, validateOnEntry, traceSteps);
      config.validate();
      return config;
    }

    private SimulatorConfigurationBuilder() {}
  }

  private void validate() throws ValidationException {
    if (validationMode == null) {
      throw new ValidationException(AutomatonException.Code.INVALID_CONFIGURATION,
          "ValidationMode cannot be null");
    }
  }

  @Override
  public String toString() {
    return "SimulatorConfiguration [validationMode=" + validationMode + ", validateOnEntry="
        + validateOnEntry + ", traceSteps=" + traceSteps + "]";
  }

  private SimulatorConfiguration(final ValidationMode validationMode,
      final boolean validateOnEntry, final boolean traceSteps) {
    this.validationMode = validationMode;
    this.validateOnEntry = validateOnEntry;
    this.traceSteps = traceSteps;
  }

}
