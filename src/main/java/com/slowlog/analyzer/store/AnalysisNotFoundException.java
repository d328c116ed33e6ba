package com.slowlog.analyzer.store;

import com.slowlog.analyzer.SlowLogException;

public class AnalysisNotFoundException extends SlowLogException {

    private static final long serialVersionUID = 1L;

    private final String name;

    public AnalysisNotFoundException(String name) {
        super("Analysis not found: " + name);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
