package dev.jobtracker.model;

import lombok.Builder;
import lombok.Data;

/**
 * Single listing submitted by the browser extension, already extracted from the page.
 */
@Data
@Builder
public class CaptureRequest {
    private String url;
    private String title;
    private String company;
    private String location;
    private String description;
    private String source;
}
