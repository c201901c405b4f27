package com.aegis.build.record;

public class DuplicateVersionException extends RuntimeException {

    public DuplicateVersionException(String version) {
        super("Version already recorded: " + version);
    }

    public DuplicateVersionException(String version, Throwable cause) {
        super("Version already recorded: " + version, cause);
    }
}
