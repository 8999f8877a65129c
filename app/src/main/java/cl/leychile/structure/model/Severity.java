package cl.leychile.structure.model;

public enum Severity {
    INFO,
    WARNING,
    ERROR
}
