package no.cantara.siren.model;

import java.util.Locale;

public enum Severity {
    WARNING,
    ERROR;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
