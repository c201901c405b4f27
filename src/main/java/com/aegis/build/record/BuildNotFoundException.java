package com.aegis.build.record;

public class BuildNotFoundException extends RuntimeException {

    public BuildNotFoundException(Long buildId) {
        super("Build not found: " + buildId);
    }

    public BuildNotFoundException(String version) {
        super("Build not found for version: " + version);
    }
}
