package com.sketchsync.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

// Text frame from the relay, e.g. {"type":"error","message":"..."}
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ControlMessageDTO {
    public static final String TYPE_ERROR = "error";
    public static final String TYPE_INFO = "info";

    private String type;
    private String message;
}
