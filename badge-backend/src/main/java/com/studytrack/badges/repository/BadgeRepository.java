package com.studytrack.badges.repository;

import com.studytrack.badges.entity.Badge;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface BadgeRepository extends JpaRepository<Badge, String> {

    // 目录的自然顺序：display_order，再按 id 保证稳定
    List<Badge> findAllByOrderByDisplayOrderAscIdAsc();
}
