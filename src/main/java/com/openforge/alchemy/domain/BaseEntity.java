package com.openforge.alchemy.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.LocalDateTime;

/**
 * Canonical audit columns shared by every store table.
 *
 * - create_time  : set once on INSERT, never touched again
 * - update_time  : refreshed on every UPDATE
 * - version      : JPA @Version; a concurrent writer that flushes a stale
 *                  copy of the same row fails instead of overwriting
 *
 * Identifiers are declared by each entity: candidates carry assigned UUIDs,
 * edges an identity column, config entries their key. version stays null until
 * the first flush so Spring Data can tell a new row from an existing one even
 * when the id was assigned up front.
 */
@Getter
@Setter
@MappedSuperclass
@EntityListeners(AuditingEntityListener.class)
public abstract class BaseEntity {

    @CreatedDate
    @Column(name = "create_time", nullable = false, updatable = false)
    private LocalDateTime createTime;

    @LastModifiedDate
    @Column(name = "update_time", nullable = false)
    private LocalDateTime updateTime;

    @Version
    @Column(nullable = false)
    private Integer version;
}
