package com.cos.race_prevention.common.init;

import com.cos.race_prevention.blogview.entity.Post;
import com.cos.race_prevention.blogview.repository.PostRepository;
import com.cos.race_prevention.gameshop.entity.Player;
import com.cos.race_prevention.gameshop.repository.PlayerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

/**
 * 시작 시 예제 데이터 생성 (멱등)
 *
 * 존재 여부를 먼저 조회하지 않고 바로 INSERT 함.
 * 이미 있으면 PK 제약 위반으로 실패하고, 그 실패는 "이미 초기화됨"으로 간주.
 * 기존 행의 값(views, money, level)은 절대 덮어쓰지 않음
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "race-prevention.seed", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SeedDataInitializer implements ApplicationRunner {

    public static final Long SEED_POST_ID = 1L;
    public static final Long SEED_PLAYER_ID = 1L;

    private final PostRepository postRepository;
    private final PlayerRepository playerRepository;

    @Override
    public void run(ApplicationArguments args) {
        seed();
    }

    public void seed() {
        createPost();
        createPlayer();
    }

    private void createPost() {
        try {
            log.info("Creating test blog post...");
            postRepository.saveAndFlush(new Post(SEED_POST_ID, "Example blog post", "Hello! This is a blog post"));
            log.info("Test blog post created");
        } catch (DataIntegrityViolationException e) {
            log.info("Blog post already exists");
        }
    }

    private void createPlayer() {
        try {
            log.info("Creating test user...");
            playerRepository.saveAndFlush(new Player(SEED_PLAYER_ID, "Alice", 1000, 1));
            log.info("Test user created");
        } catch (DataIntegrityViolationException e) {
            log.info("User already exists");
        }
    }
}
