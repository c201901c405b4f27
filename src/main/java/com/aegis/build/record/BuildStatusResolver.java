package com.aegis.build.record;

public final class BuildStatusResolver {

    private static final int SUCCESS = 0;

    private BuildStatusResolver() {}

    public static BuildStatus resolveStatus(Build build) {
        if (build.isDeleted()) {
            return BuildStatus.DELETED;
        }

        if (build.getRevertExitStatus() != null) {
            return succeeded(build.getRevertExitStatus()) ? BuildStatus.REVERTED : BuildStatus.REVERT_FAILED;
        }

        if (build.getDeployExitStatus() != null) {
            return succeeded(build.getDeployExitStatus()) ? BuildStatus.DEPLOYED : BuildStatus.DEPLOY_FAILED;
        }

        if (build.getBuildExitStatus() != null) {
            return succeeded(build.getBuildExitStatus()) ? BuildStatus.BUILT : BuildStatus.BUILD_FAILED;
        }

        return BuildStatus.STARTED;
    }

    static boolean succeeded(Integer exitStatus) {
        return exitStatus != null && exitStatus == SUCCESS;
    }
}
