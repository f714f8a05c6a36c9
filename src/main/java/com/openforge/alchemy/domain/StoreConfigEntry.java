package com.openforge.alchemy.domain;

import jakarta.persistence.*;
import lombok.*;

/**
 * A persisted policy setting. Values are always strings; readers decide
 * whether to interpret them as int, double or boolean.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "store_config")
public class StoreConfigEntry extends BaseEntity {

    @Id
    @Column(name = "config_key", nullable = false, updatable = false, length = 128)
    private String key;

    @Column(name = "config_value", nullable = false, columnDefinition = "TEXT")
    private String value;
}
