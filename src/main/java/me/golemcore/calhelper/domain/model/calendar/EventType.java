package me.golemcore.calhelper.domain.model.calendar;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Bookable event type. Only the fields useful to the model are kept.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class EventType {

    private Long id;
    private Integer lengthInMinutes;
    private String title;
    private String slug;
    private String description;
    private List<Map<String, Object>> locations;
}
