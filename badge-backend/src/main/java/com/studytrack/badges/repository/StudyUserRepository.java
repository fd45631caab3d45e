package com.studytrack.badges.repository;

import com.studytrack.badges.entity.StudyUser;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface StudyUserRepository extends JpaRepository<StudyUser, UUID> {
}
