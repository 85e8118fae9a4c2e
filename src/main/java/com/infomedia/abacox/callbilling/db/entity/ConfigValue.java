package com.infomedia.abacox.callbilling.db.entity;

import com.infomedia.abacox.callbilling.db.entity.superclass.AuditedEntity;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;

@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@SuperBuilder(toBuilder = true)
@Entity
@Table(name = "config_value")
public class ConfigValue extends AuditedEntity {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false)
    private Long id;

    @Column(name = "config_key", nullable = false, length = 100, unique = true)
    private String key;

    @Column(name = "config_value", length = 1024)
    private String value;
}
