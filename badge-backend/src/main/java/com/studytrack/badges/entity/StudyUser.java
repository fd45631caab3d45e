package com.studytrack.badges.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * 用户基础信息表 users，仅用于排行榜展示昵称。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "users")
public class StudyUser {

    @Id
    @Column(name = "id")
    private UUID id;

    @Column(name = "username", nullable = false, length = 100)
    private String username;
}
