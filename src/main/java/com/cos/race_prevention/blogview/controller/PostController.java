package com.cos.race_prevention.blogview.controller;

import com.cos.race_prevention.blogview.dto.PostResponse;
import com.cos.race_prevention.blogview.dto.ViewResponse;
import com.cos.race_prevention.blogview.service.PostViewService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class PostController {

    private final PostViewService postViewService;

    @GetMapping("/post/{postId}")
    public PostResponse getPost(@PathVariable Long postId) {
        return PostResponse.from(postViewService.getPost(postId));
    }

    @PostMapping("/view/{postId}")
    public ViewResponse viewPost(@PathVariable Long postId) {
        return new ViewResponse(postViewService.view(postId));
    }
}
