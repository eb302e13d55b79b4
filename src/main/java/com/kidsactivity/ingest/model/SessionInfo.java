package com.kidsactivity.ingest.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class SessionInfo {
    private Integer sessionNumber;
    private String date;
    private String dayOfWeek;
    private String startTime;
    private String endTime;
    private String location;
    private String instructor;
}
