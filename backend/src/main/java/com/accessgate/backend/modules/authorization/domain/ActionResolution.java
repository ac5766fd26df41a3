package com.accessgate.backend.modules.authorization.domain;

public record ActionResolution(String action, Source source) {

    public enum Source {
        CATALOG,
        CONVENTION
    }

    public static ActionResolution fromCatalog(String action) {
        return new ActionResolution(action, Source.CATALOG);
    }

    public static ActionResolution fromConvention(String action) {
        return new ActionResolution(action, Source.CONVENTION);
    }
}
