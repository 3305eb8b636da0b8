package com.solrange.analyzer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Progress and warning output for one analysis. Messages go to stderr with the tool tag;
 * warnings are also kept so callers (and tests) can inspect what was approximated.
 */
public class Diagnostics {

    private static final String TAG = "[sol-range] ";

    private final List<String> warnings = new ArrayList<>();
    private final boolean quiet;

    public Diagnostics() {
        this(false);
    }

    /** @param quiet when true nothing is printed; warnings are still recorded */
    public Diagnostics(boolean quiet) {
        this.quiet = quiet;
    }

    public void info(String message) {
        if (!quiet) System.err.println(TAG + message);
    }

    public void warn(String message) {
        warnings.add(message);
        if (!quiet) System.err.println(TAG + "WARNING: " + message);
    }

    public List<String> warnings() {
        return Collections.unmodifiableList(warnings);
    }
}
