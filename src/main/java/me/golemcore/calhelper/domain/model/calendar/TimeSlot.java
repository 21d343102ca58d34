package me.golemcore.calhelper.domain.model.calendar;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class TimeSlot {

    private String start;
}
