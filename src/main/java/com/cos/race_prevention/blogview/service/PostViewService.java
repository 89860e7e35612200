package com.cos.race_prevention.blogview.service;

import com.cos.race_prevention.blogview.entity.Post;
import com.cos.race_prevention.blogview.repository.PostRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 조회수 서비스 - 원자적 UPDATE 사용
 *
 * 잘못된 방식 (Lost Update):
 * 1. Thread A가 views=10 읽음
 * 2. Thread B가 views=10 읽음
 * 3. Thread A가 views=11 저장
 * 4. Thread B가 views=11 저장
 * 결과: 2번 조회했는데 1만 증가
 *
 * 이 서비스의 방식:
 * UPDATE posts SET views = views + 1 WHERE id = ?
 * 애플리케이션은 views를 읽지 않고, 계산은 DB가 현재 값으로 수행.
 * 락도 재시도도 필요 없음
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PostViewService {

    private final PostRepository postRepository;

    /**
     * 게시글 조회 (조회수 변경 없음)
     */
    @Transactional(readOnly = true)
    public Post getPost(Long postId) {
        return postRepository.findById(postId)
                .orElseThrow(() -> new PostNotFoundException(postId));
    }

    /**
     * 조회수 +1 후 현재 조회수 반환
     *
     * 반환값은 재조회 시점의 최신 커밋 값이므로
     * 그 사이 다른 요청의 증가분이 포함될 수 있음 (저장된 합계는 항상 정확)
     */
    @Transactional
    public Long view(Long postId) {
        int updated = postRepository.incrementViews(postId);
        if (updated == 0) {
            throw new PostNotFoundException(postId);
        }

        Long views = getPost(postId).getViews();
        log.debug("[view] postId={}, views={}", postId, views);
        return views;
    }
}
