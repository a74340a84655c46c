package com.studystats.repository;

import com.studystats.model.UserSyncRecord;
import org.springframework.data.jpa.repository.JpaRepository;

public interface UserSyncRepository extends JpaRepository<UserSyncRecord, String> {
}
