package me.golemcore.calhelper.domain.model.calendar;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * Profile of the authenticated calendar user.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class CalendarProfile {

    private Long id;
    private String username;
    private String email;
    private String name;
    private String timeZone;
    private String timeFormat;
    private String weekStart;
}
