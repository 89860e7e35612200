package com.cos.race_prevention.blogview.dto;

import com.cos.race_prevention.blogview.entity.Post;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class PostResponse {

    @JsonProperty("post_id")
    private final Long postId;
    private final String title;
    private final String content;
    private final Long views;

    public static PostResponse from(Post post) {
        return new PostResponse(post.getId(), post.getTitle(), post.getContent(), post.getViews());
    }
}
