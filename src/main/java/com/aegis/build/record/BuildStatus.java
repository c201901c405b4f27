package com.aegis.build.record;

public enum BuildStatus {
    STARTED,
    BUILD_FAILED,
    BUILT,
    DEPLOY_FAILED,
    DEPLOYED,
    REVERT_FAILED,
    REVERTED,
    DELETED
}
