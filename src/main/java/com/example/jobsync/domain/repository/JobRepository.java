package com.example.jobsync.domain.repository;

import com.example.jobsync.domain.entity.Job;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for Job definitions, keyed by their unique name.
 */
@Repository
public interface JobRepository extends JpaRepository<Job, Long> {

    Optional<Job> findByName(String name);

    boolean existsByName(String name);

    List<Job> findAllByOrderByNameAsc();

    List<Job> findByNameIn(Collection<String> names);

    long countByEnabled(boolean enabled);

    long countByLastRunSuccess(Boolean lastRunSuccess);
}
