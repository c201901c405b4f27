package com.aegis.build.record;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.SQLRestriction;
import org.hibernate.type.SqlTypes;

@Entity
@Table(name = "build")
@SQLRestriction("delete_dttm IS NULL")
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Build {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "build_id", nullable = false, updatable = false)
    private Long buildId;

    @Column(nullable = false, length = 100)
    private String branch;

    @Column(nullable = false, length = 100)
    private String revision;

    @Column(unique = true, length = 100)
    private String version;

    @JdbcTypeCode(SqlTypes.LONGVARCHAR)
    @Column(name = "build_output_tx")
    private String buildOutput;

    @Column(name = "build_exit_status")
    private Integer buildExitStatus;

    @Column(name = "build_exec_sec")
    private BigDecimal buildExecSec;

    @Column(name = "build_size")
    private BigDecimal buildSize;

    @Column(name = "previous_version", length = 100)
    private String previousVersion;

    @Column(name = "deploy_dttm")
    private Instant deployedAt;

    @JdbcTypeCode(SqlTypes.LONGVARCHAR)
    @Column(name = "deploy_output_tx")
    private String deployOutput;

    @Column(name = "deploy_exit_status")
    private Integer deployExitStatus;

    @Column(name = "revert_dttm")
    private Instant revertedAt;

    @JdbcTypeCode(SqlTypes.LONGVARCHAR)
    @Column(name = "revert_output_tx")
    private String revertOutput;

    @Column(name = "revert_exit_status")
    private Integer revertExitStatus;

    @Column(name = "create_dttm", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "update_dttm", nullable = false)
    private Instant updatedAt;

    @Column(name = "delete_dttm")
    private Instant deletedAt;

    @Transient
    private boolean touched;

    public void recordBuild(
            String version,
            String output,
            Integer exitStatus,
            BigDecimal execSec,
            BigDecimal size,
            String previousVersion) {
        this.version = version;
        this.buildOutput = output;
        this.buildExitStatus = exitStatus;
        this.buildExecSec = execSec;
        this.buildSize = size;
        this.previousVersion = previousVersion;
    }

    public void recordDeploy(Instant deployedAt, String output, Integer exitStatus) {
        this.deployedAt = deployedAt;
        this.deployOutput = output;
        this.deployExitStatus = exitStatus;
    }

    public void recordRevert(Instant revertedAt, String output, Integer exitStatus) {
        this.revertedAt = revertedAt;
        this.revertOutput = output;
        this.revertExitStatus = exitStatus;
    }

    public void markDeleted(Instant deletedAt) {
        this.deletedAt = deletedAt;
    }

    public void touch(Instant now) {
        advanceUpdatedAt(now);
        touched = true;
    }

    public boolean isDeleted() {
        return deletedAt != null;
    }

    @PrePersist
    void onPersist() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }

    @PreUpdate
    void onUpdate() {
        if (!touched) {
            advanceUpdatedAt(Instant.now());
        }
        touched = false;
    }

    // update_dttm never moves backwards
    private void advanceUpdatedAt(Instant now) {
        if (updatedAt == null || now.isAfter(updatedAt)) {
            updatedAt = now;
        }
    }
}
