package com.aegis.build.record;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;

@Service
@Validated
@Slf4j
public class BuildService {

    private static final String UNIQUE_VIOLATION = "23505";
    private static final String MYSQL_INTEGRITY_VIOLATION = "23000";
    private static final int MYSQL_DUPLICATE_ENTRY = 1062;

    private final BuildRepository buildRepository;
    private final Clock clock;
    private final int recentLimit;

    public BuildService(
            BuildRepository buildRepository,
            Clock clock,
            @Value("${builds.recent-limit:50}") int recentLimit) {
        this.buildRepository = buildRepository;
        this.clock = clock;
        this.recentLimit = recentLimit > 0 ? recentLimit : 50;
    }

    @Transactional
    public BuildResponse start(@NotNull @Valid BuildStartRequest request) {
        Instant now = Instant.now(clock);
        Build build =
                Build.builder()
                        .branch(request.getBranch().trim())
                        .revision(request.getRevision().trim())
                        .createdAt(now)
                        .updatedAt(now)
                        .build();

        Build saved = buildRepository.save(build);
        log.info(
                "Started build {} for branch {} at revision {}",
                saved.getBuildId(),
                saved.getBranch(),
                saved.getRevision());

        return toResponse(saved);
    }

    @Transactional
    public BuildResponse recordBuild(@NotNull Long buildId, @NotNull @Valid BuildResultRequest request) {
        Build build = load(buildId);
        String version = trimToNull(request.getVersion());

        if (version != null
                && !version.equals(build.getVersion())
                && buildRepository.existsByVersion(version)) {
            log.warn("Rejected version {} for build {}: already recorded", version, buildId);
            throw new DuplicateVersionException(version);
        }

        String previousVersion = trimToNull(request.getPreviousVersion());
        if (previousVersion == null) {
            previousVersion =
                    buildRepository
                            .findCurrentDeployment(build.getBranch())
                            .filter(deployed -> !deployed.getBuildId().equals(build.getBuildId()))
                            .map(Build::getVersion)
                            .orElse(null);
        }

        build.recordBuild(
                version,
                request.getOutput(),
                request.getExitStatus(),
                request.getExecSec(),
                request.getSize(),
                previousVersion);
        build.touch(Instant.now(clock));

        Build saved;
        try {
            saved = buildRepository.saveAndFlush(build);
        } catch (DataIntegrityViolationException ex) {
            // soft-deleted rows still hold their version
            if (version != null && isUniqueViolation(ex)) {
                log.warn("Rejected version {} for build {}: unique key violation", version, buildId);
                throw new DuplicateVersionException(version, ex);
            }
            throw ex;
        }

        log.info(
                "Recorded build {} as version {} with exit status {}",
                saved.getBuildId(),
                saved.getVersion(),
                saved.getBuildExitStatus());
        return toResponse(saved);
    }

    @Transactional
    public BuildResponse recordDeploy(@NotNull Long buildId, @NotNull @Valid PhaseResultRequest request) {
        Build build = load(buildId);
        build.recordDeploy(occurredAt(request), request.getOutput(), request.getExitStatus());
        build.touch(Instant.now(clock));

        Build saved = buildRepository.save(build);
        log.info(
                "Recorded deploy of build {} ({}) with exit status {}",
                saved.getBuildId(),
                saved.getVersion(),
                saved.getDeployExitStatus());
        return toResponse(saved);
    }

    @Transactional
    public BuildResponse recordRevert(@NotNull Long buildId, @NotNull @Valid PhaseResultRequest request) {
        Build build = load(buildId);
        if (build.getDeployedAt() == null) {
            log.warn("Rejected revert of build {}: never deployed", buildId);
            throw new IllegalStateException("Build has not been deployed: " + buildId);
        }
        build.recordRevert(occurredAt(request), request.getOutput(), request.getExitStatus());
        build.touch(Instant.now(clock));

        Build saved = buildRepository.save(build);
        log.info(
                "Recorded revert of build {} ({}) with exit status {}",
                saved.getBuildId(),
                saved.getVersion(),
                saved.getRevertExitStatus());
        return toResponse(saved);
    }

    @Transactional(readOnly = true)
    public BuildResponse findById(@NotNull Long buildId) {
        return toResponse(load(buildId));
    }

    @Transactional(readOnly = true)
    public BuildResponse findByVersion(@NotBlank String version) {
        return buildRepository
                .findByVersion(version.trim())
                .map(this::toResponse)
                .orElseThrow(() -> new BuildNotFoundException(version));
    }

    @Transactional(readOnly = true)
    public List<BuildResponse> findRecent(String branch, Integer limit) {
        Pageable page = PageRequest.of(0, limit == null || limit <= 0 ? recentLimit : limit);
        List<Build> builds =
                StringUtils.hasText(branch)
                        ? buildRepository.findAllByBranchOrderByBuildIdDesc(branch.trim(), page)
                        : buildRepository.findAllByOrderByBuildIdDesc(page);
        return builds.stream().map(this::toResponse).toList();
    }

    @Transactional(readOnly = true)
    public Optional<BuildResponse> findCurrentDeployment(@NotBlank String branch) {
        return buildRepository.findCurrentDeployment(branch.trim()).map(this::toResponse);
    }

    @Transactional
    public BuildResponse delete(@NotNull Long buildId) {
        Build build = load(buildId);
        Instant now = Instant.now(clock);
        build.markDeleted(now);
        build.touch(now);

        Build saved = buildRepository.save(build);
        log.info("Soft-deleted build {} ({})", saved.getBuildId(), saved.getVersion());
        return toResponse(saved);
    }

    private Build load(Long buildId) {
        // a row deleted earlier in this transaction is still cached by the session
        return buildRepository
                .findById(buildId)
                .filter(build -> !build.isDeleted())
                .orElseThrow(() -> new BuildNotFoundException(buildId));
    }

    private Instant occurredAt(PhaseResultRequest request) {
        return request.getOccurredAt() != null ? request.getOccurredAt() : Instant.now(clock);
    }

    private static boolean isUniqueViolation(DataIntegrityViolationException ex) {
        for (Throwable cause = ex; cause != null; cause = cause.getCause()) {
            if (cause instanceof SQLException sql
                    && (UNIQUE_VIOLATION.equals(sql.getSQLState())
                            || (MYSQL_INTEGRITY_VIOLATION.equals(sql.getSQLState())
                                    && sql.getErrorCode() == MYSQL_DUPLICATE_ENTRY))) {
                return true;
            }
        }
        return false;
    }

    private static String trimToNull(String value) {
        return StringUtils.hasText(value) ? value.trim() : null;
    }

    private BuildResponse toResponse(Build entity) {
        return BuildResponse.builder()
                .buildId(entity.getBuildId())
                .branch(entity.getBranch())
                .revision(entity.getRevision())
                .version(entity.getVersion())
                .status(BuildStatusResolver.resolveStatus(entity))
                .buildOutput(entity.getBuildOutput())
                .buildExitStatus(entity.getBuildExitStatus())
                .buildExecSec(entity.getBuildExecSec())
                .buildSize(entity.getBuildSize())
                .previousVersion(entity.getPreviousVersion())
                .deployedAt(entity.getDeployedAt())
                .deployOutput(entity.getDeployOutput())
                .deployExitStatus(entity.getDeployExitStatus())
                .revertedAt(entity.getRevertedAt())
                .revertOutput(entity.getRevertOutput())
                .revertExitStatus(entity.getRevertExitStatus())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .deletedAt(entity.getDeletedAt())
                .build();
    }
}
