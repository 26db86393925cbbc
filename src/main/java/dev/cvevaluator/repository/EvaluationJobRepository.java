package dev.cvevaluator.repository;

import dev.cvevaluator.entity.EvaluationJob;
import dev.cvevaluator.model.JobStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface EvaluationJobRepository extends JpaRepository<EvaluationJob, String> {

    /**
     * Find jobs in any of the given states, e.g. to requeue work left behind by a restart.
     */
    List<EvaluationJob> findByStatusIn(Collection<JobStatus> statuses);
}
