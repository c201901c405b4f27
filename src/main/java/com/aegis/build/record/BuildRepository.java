package com.aegis.build.record;

import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface BuildRepository extends JpaRepository<Build, Long> {

    Optional<Build> findByVersion(String version);

    boolean existsByVersion(String version);

    List<Build> findAllByOrderByBuildIdDesc(Pageable pageable);

    List<Build> findAllByBranchOrderByBuildIdDesc(String branch, Pageable pageable);

    // a failed revert leaves the deployed version running
    @Query("select b from Build b where b.branch = :branch and b.deployExitStatus = 0"
            + " and (b.revertedAt is null or b.revertExitStatus <> 0)"
            + " order by b.deployedAt desc, b.buildId desc")
    List<Build> findLiveDeployments(@Param("branch") String branch, Pageable pageable);

    default Optional<Build> findCurrentDeployment(String branch) {
        return findLiveDeployments(branch, PageRequest.of(0, 1)).stream().findFirst();
    }
}
