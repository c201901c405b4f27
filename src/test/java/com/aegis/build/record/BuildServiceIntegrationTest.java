package com.aegis.build.record;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import jakarta.persistence.EntityManager;
import jakarta.validation.ConstraintViolationException;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.transaction.annotation.Transactional;

@SpringBootTest
@AutoConfigureTestDatabase
@Transactional
class BuildServiceIntegrationTest {

    @Autowired
    private BuildService buildService;

    @Autowired
    private EntityManager entityManager;

    @Test
    void recordsBuildDeployAndRevertOnOneRow() {
        BuildResponse started =
                buildService.start(BuildStartRequest.builder().branch("main").revision("abc123").build());
        Long id = started.getBuildId();

        buildService.recordBuild(
                id,
                BuildResultRequest.builder()
                        .version("it-1.0.0")
                        .output("BUILD SUCCESS")
                        .exitStatus(0)
                        .execSec(new BigDecimal("41"))
                        .build());
        buildService.recordDeploy(id, PhaseResultRequest.builder().output("deployed").exitStatus(0).build());
        buildService.recordRevert(id, PhaseResultRequest.builder().output("reverted").exitStatus(0).build());

        BuildResponse reloaded = buildService.findById(id);
        assertThat(reloaded.getStatus()).isEqualTo(BuildStatus.REVERTED);
        assertThat(reloaded.getVersion()).isEqualTo("it-1.0.0");
        assertThat(reloaded.getDeployedAt()).isNotNull();
        assertThat(reloaded.getRevertedAt()).isNotNull();
        assertThat(reloaded.getCreatedAt()).isEqualTo(started.getCreatedAt());
        assertThat(buildService.findByVersion("it-1.0.0").getBuildId()).isEqualTo(id);
    }

    @Test
    void newBuildPointsAtCurrentDeployment() {
        Long first = buildService.start(BuildStartRequest.builder().branch("it-main").revision("r1").build()).getBuildId();
        buildService.recordBuild(first, BuildResultRequest.builder().version("it-2.0.0").exitStatus(0).build());
        buildService.recordDeploy(first, PhaseResultRequest.builder().exitStatus(0).build());

        Long second = buildService.start(BuildStartRequest.builder().branch("it-main").revision("r2").build()).getBuildId();
        BuildResponse built =
                buildService.recordBuild(second, BuildResultRequest.builder().version("it-2.1.0").exitStatus(0).build());

        assertThat(built.getPreviousVersion()).isEqualTo("it-2.0.0");
        assertThat(buildService.findCurrentDeployment("it-main"))
                .map(BuildResponse::getVersion)
                .contains("it-2.0.0");

        List<BuildResponse> recent = buildService.findRecent("it-main", 10);
        assertThat(recent).extracting(BuildResponse::getBuildId).containsExactly(second, first);
    }

    @Test
    void deletedBuildIsNoLongerFound() {
        Long id = buildService.start(BuildStartRequest.builder().branch("it-gone").revision("r1").build()).getBuildId();

        assertThat(buildService.delete(id).getStatus()).isEqualTo(BuildStatus.DELETED);
        assertThatThrownBy(() -> buildService.findById(id)).isInstanceOf(BuildNotFoundException.class);
        assertThat(buildService.findRecent("it-gone", null)).isEmpty();
    }

    @Test
    void startRejectsBlankBranch() {
        BuildStartRequest request = BuildStartRequest.builder().branch(" ").revision("abc123").build();

        assertThatThrownBy(() -> buildService.start(request)).isInstanceOf(ConstraintViolationException.class);
    }

    @Test
    void failedRevertKeepsVersionCurrentForNextBuild() {
        Long first = buildService.start(BuildStartRequest.builder().branch("it-stuck").revision("r1").build()).getBuildId();
        buildService.recordBuild(first, BuildResultRequest.builder().version("it-3.0.0").exitStatus(0).build());
        buildService.recordDeploy(first, PhaseResultRequest.builder().exitStatus(0).build());
        BuildResponse revert =
                buildService.recordRevert(first, PhaseResultRequest.builder().output("denied").exitStatus(1).build());

        Long second = buildService.start(BuildStartRequest.builder().branch("it-stuck").revision("r2").build()).getBuildId();
        BuildResponse built =
                buildService.recordBuild(second, BuildResultRequest.builder().version("it-3.1.0").exitStatus(0).build());

        assertThat(revert.getStatus()).isEqualTo(BuildStatus.REVERT_FAILED);
        assertThat(buildService.findCurrentDeployment("it-stuck"))
                .map(BuildResponse::getVersion)
                .contains("it-3.0.0");
        assertThat(built.getPreviousVersion()).isEqualTo("it-3.0.0");
    }

    @Test
    void recordBuildRejectsFractionalDuration() {
        Long id = buildService.start(BuildStartRequest.builder().branch("it-main").revision("r5").build()).getBuildId();
        BuildResultRequest request =
                BuildResultRequest.builder().version("it-5.0.0").exitStatus(0).execSec(new BigDecimal("12.5")).build();

        assertThatThrownBy(() -> buildService.recordBuild(id, request))
                .isInstanceOf(ConstraintViolationException.class);
    }

    @Test
    void recordBuildRejectsSizeBeyondColumnRange() {
        Long id = buildService.start(BuildStartRequest.builder().branch("it-main").revision("r6").build()).getBuildId();
        BuildResultRequest request =
                BuildResultRequest.builder().version("it-6.0.0").exitStatus(0).size(new BigDecimal("100000000000")).build();

        assertThatThrownBy(() -> buildService.recordBuild(id, request))
                .isInstanceOf(ConstraintViolationException.class);
    }

    @Test
    void storedDurationAndSizeMatchResponse() {
        Long id = buildService.start(BuildStartRequest.builder().branch("it-main").revision("r7").build()).getBuildId();
        BuildResponse built =
                buildService.recordBuild(
                        id,
                        BuildResultRequest.builder()
                                .version("it-7.0.0")
                                .exitStatus(0)
                                .execSec(new BigDecimal("125"))
                                .size(new BigDecimal("9999999999"))
                                .build());
        entityManager.flush();
        entityManager.clear();

        BuildResponse reloaded = buildService.findById(id);
        assertThat(reloaded.getBuildExecSec()).isEqualByComparingTo(built.getBuildExecSec());
        assertThat(reloaded.getBuildSize()).isEqualByComparingTo("9999999999");
    }

    @Test
    void startRejectsMissingRequest() {
        assertThatThrownBy(() -> buildService.start(null)).isInstanceOf(ConstraintViolationException.class);
    }

    @Test
    void recordDeployRejectsMissingRequest() {
        Long id = buildService.start(BuildStartRequest.builder().branch("it-main").revision("r8").build()).getBuildId();

        assertThatThrownBy(() -> buildService.recordDeploy(id, null))
                .isInstanceOf(ConstraintViolationException.class);
    }

    @Test
    void recordBuildRejectsMissingExitStatus() {
        Long id = buildService.start(BuildStartRequest.builder().branch("it-main").revision("r9").build()).getBuildId();
        BuildResultRequest request = BuildResultRequest.builder().version("it-9.0.0").build();

        assertThatThrownBy(() -> buildService.recordBuild(id, request))
                .isInstanceOf(ConstraintViolationException.class);
    }
}
