package io.intellixity.pivot.query;

/** Node of a query filter tree. */
public interface QueryElement {}
