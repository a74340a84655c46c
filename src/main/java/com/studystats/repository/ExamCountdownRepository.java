package com.studystats.repository;

import com.studystats.model.ExamCountdown;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ExamCountdownRepository extends JpaRepository<ExamCountdown, String> {
}
