package org.gqlcg.util;

/** Marker for classes that emit messages through {@link Logger}. */
public interface IWritesLogs {}
