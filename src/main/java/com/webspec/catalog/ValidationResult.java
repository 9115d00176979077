package com.webspec.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Errors and warnings collected by {@link StepValidator}. Valid while no error was added. */
public class ValidationResult {

    private final List<ValidationIssue> errors   = new ArrayList<>();
    private final List<ValidationIssue> warnings = new ArrayList<>();

    void addError(ValidationIssue error)     { errors.add(error); }
    void addWarning(ValidationIssue warning) { warnings.add(warning); }

    public boolean               isValid()     { return errors.isEmpty(); }
    public List<ValidationIssue> getErrors()   { return Collections.unmodifiableList(errors); }
    public List<ValidationIssue> getWarnings() { return Collections.unmodifiableList(warnings); }
    public int                   errorCount()  { return errors.size(); }
    public int                   warningCount(){ return warnings.size(); }
}
