package io.intellixity.pivot.query;

public enum Clause { AND, OR }
