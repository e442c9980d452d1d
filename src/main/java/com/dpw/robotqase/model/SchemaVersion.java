package com.dpw.robotqase.model;

/**
 * Robot Framework output.xml timing conventions.
 * LEGACY (RF &lt; 7) writes {@code starttime}/{@code endtime}, CURRENT (RF 7+) writes {@code start}/{@code elapsed}.
 */
public enum SchemaVersion {
    LEGACY,
    CURRENT
}
