package io.intellixity.pivot.spi.sql;

/** Backend-native rendered statement (SQL text + binds, pipeline document, ...). */
public interface NativeStatement {
}
