package org.dxworks.cobolframe.model;

/**
 * Marker interface for the artifacts written to standard output.
 * A run yields either a program analysis ({@code ok}) or an error artifact ({@code error}).
 */
public interface Analysis {
    String STATUS_OK = "ok";
    String STATUS_ERROR = "error";

    String getStatus();
}
