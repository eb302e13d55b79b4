package com.kidsactivity.ingest.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(
        name = "activity_prerequisite",
        indexes = @Index(name = "idx_prerequisite_activity", columnList = "activity_id")
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@ToString(exclude = "activity")
public class ActivityPrerequisite {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(
            name = "activity_id",
            nullable = false,
            foreignKey = @ForeignKey(name = "fk_prerequisite_activity")
    )
    private Activity activity;

    @Column(length = 255, nullable = false)
    private String name;

    @Column(length = 1024)
    private String url;

    @Column(length = 128)
    private String courseId;

    @Builder.Default
    @Column(nullable = false)
    private boolean required = true;
}
