package com.rotseproc.core.exception;

import com.rotseproc.core.DataKind;

public class IncompatibleInputException extends RotseProcException {
    private final DataKind expected;
    private final DataKind actual;

    public IncompatibleInputException(String stageName, DataKind expected, DataKind actual) {
        super(stageName, "Stage '" + stageName + "' was expecting " + expected + " got " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public DataKind expected() {
        return expected;
    }

    public DataKind actual() {
        return actual;
    }
}
