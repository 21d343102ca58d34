package me.golemcore.calhelper.domain.model.calendar;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * Existing booking. Attendee and host details are dropped to keep the model
 * context small.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class Booking {

    private Long id;
    private String uid;
    private String title;
    private String description;
    private String status;
    private String start;
    private String end;
    private Integer duration;
}
