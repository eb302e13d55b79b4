package com.kidsactivity.ingest.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(
        name = "activity_session",
        indexes = @Index(name = "idx_session_activity", columnList = "activity_id")
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@ToString(exclude = "activity")
public class ActivitySession {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(
            name = "activity_id",
            nullable = false,
            foreignKey = @ForeignKey(name = "fk_session_activity")
    )
    private Activity activity;

    private Integer sessionNumber;

    @Column(length = 32)
    private String sessionDate;

    @Column(length = 16)
    private String dayOfWeek;

    @Column(length = 16)
    private String startTime;

    @Column(length = 16)
    private String endTime;

    @Column(length = 255)
    private String location;

    @Column(length = 255)
    private String instructor;
}
