package io.limitgraph.runner;

public enum RunnerKind {
    ECHO,
    SCRIPT,
    PYTHON
}
