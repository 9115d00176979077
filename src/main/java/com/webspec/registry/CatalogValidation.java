package com.webspec.registry;

import java.util.List;

/**
 * Outcome of {@link StepPatternRegistry#validate()}: OK, or the duplicates found.
 */
public final class CatalogValidation {

    private static final CatalogValidation OK = new CatalogValidation(List.of());

    private final List<DuplicatePatternWarning> warnings;

    private CatalogValidation(List<DuplicatePatternWarning> warnings) {
        this.warnings = List.copyOf(warnings);
    }

    public static CatalogValidation ok() {
        return OK;
    }

    public static CatalogValidation of(List<DuplicatePatternWarning> warnings) {
        return warnings.isEmpty() ? OK : new CatalogValidation(warnings);
    }

    public boolean isOk()                              { return warnings.isEmpty(); }
    public List<DuplicatePatternWarning> getWarnings() { return warnings; }

    @Override
    public String toString() {
        return isOk() ? "CatalogValidation{OK}" : "CatalogValidation{duplicates=" + warnings.size() + "}";
    }
}
