package org.vain.runtime;

import java.io.Serial;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Reports every error of a build at once. Errors of independent files are
 * collected rather than failing on the first one.
 */
public class VainBuildException extends Exception {
    @Serial
    private static final long serialVersionUID = 1L;

    private final List<String> errors;

    public VainBuildException(List<String> errors) {
        super(String.join("\n", errors));
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
    }

    public List<String> getErrors() {
        return errors;
    }
}
