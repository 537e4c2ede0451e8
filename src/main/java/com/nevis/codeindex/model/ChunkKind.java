package com.nevis.codeindex.model;

public enum ChunkKind {
    FUNCTION,
    METHOD,
    CONSTRUCTOR,
    CLASS,
    INTERFACE,
    ENUM,
    RECORD,
    TYPE_ALIAS,
    IMPLEMENTATION,
    CONSTANT,
    MODULE,
    DOCUMENT,
    CONFIG;

    public boolean isCallable() {
        return this == FUNCTION || this == METHOD || this == CONSTRUCTOR;
    }

    public boolean isType() {
        return this == CLASS || this == INTERFACE || this == ENUM || this == RECORD;
    }
}
