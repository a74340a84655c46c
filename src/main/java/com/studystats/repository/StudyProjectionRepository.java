package com.studystats.repository;

import com.studystats.model.StudyProjection;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * One row per user; save() on an existing user id is an upsert.
 */
public interface StudyProjectionRepository extends JpaRepository<StudyProjection, String> {
}
