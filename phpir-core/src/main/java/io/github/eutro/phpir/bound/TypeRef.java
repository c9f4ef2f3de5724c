package io.github.eutro.phpir.bound;

/**
 * The PHP types the rewriter needs to name: conversion targets,
 * and the target types of {@link BoundAccess accesses}.
 */
public enum TypeRef {
    BOOL("bool"),
    LONG("int"),
    DOUBLE("float"),
    STRING("string"),
    ARRAY("array"),
    OBJECT("object"),
    CALLABLE("callable"),
    MIXED("mixed"),
    ;

    public final String phpName;

    TypeRef(String phpName) {
        this.phpName = phpName;
    }

    @Override
    public String toString() {
        return phpName;
    }
}
