package com.taskpilot.orchestrator.repository;

import com.taskpilot.orchestrator.model.Job;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface JobRepository extends JpaRepository<Job, UUID> {

    List<Job> findByTaskIdOrderByCreatedAtDesc(UUID taskId);
}
