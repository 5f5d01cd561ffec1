package com.hotelintel.sampler.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Review block as scraped. Axis scores arrive as the CSS width of the star bar,
 * e.g. "width:80%".
 */
@Data
@Builder
public class RawReview {
    private String author;
    private String content;
    private String summary;
    private List<String> scoreStyles;
    private String dateText;
    private List<String> imageUrls;
    private String roomType;
    private String replyContent;
    private String replyDateText;
}
