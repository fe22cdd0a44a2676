package com.behaviortwin.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class SocialPost {
    String platform;
    String board;
    String title;
    String url;
    String author;
    String timestamp;
    int likes;
    int comments;
    List<String> keywords;
    int sentiment;
}
