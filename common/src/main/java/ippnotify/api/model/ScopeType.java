package ippnotify.api.model;

public enum ScopeType {
    SYSTEM, PRINTER, JOB
}
