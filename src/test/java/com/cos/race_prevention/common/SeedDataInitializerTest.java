package com.cos.race_prevention.common;

import com.cos.race_prevention.PostgresIntegrationTest;
import com.cos.race_prevention.blogview.repository.PostRepository;
import com.cos.race_prevention.blogview.service.PostViewService;
import com.cos.race_prevention.common.init.SeedDataInitializer;
import com.cos.race_prevention.gameshop.entity.Player;
import com.cos.race_prevention.gameshop.repository.PlayerRepository;
import com.cos.race_prevention.gameshop.service.UpgradeService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

/**
 * 시작 시 데이터 생성이 멱등인지 확인
 */
@SpringBootTest
class SeedDataInitializerTest extends PostgresIntegrationTest {

    @Autowired
    private SeedDataInitializer seedDataInitializer;

    @Autowired
    private PostRepository postRepository;

    @Autowired
    private PlayerRepository playerRepository;

    @Autowired
    private PostViewService postViewService;

    @Autowired
    private UpgradeService upgradeService;

    private static final Long POST_ID = SeedDataInitializer.SEED_POST_ID;
    private static final Long PLAYER_ID = SeedDataInitializer.SEED_PLAYER_ID;

    @BeforeEach
    void setUp() {
        postRepository.deleteAll();
        playerRepository.deleteAll();
    }

    @Test
    @DisplayName("빈 DB -> 예제 게시글/플레이어 생성")
    void seedsEmptyStore() {
        seedDataInitializer.seed();

        assertThat(postViewService.getPost(POST_ID).getTitle()).isEqualTo("Example blog post");
        assertThat(postViewService.getPost(POST_ID).getViews()).isZero();

        Player player = upgradeService.getPlayer(PLAYER_ID);
        assertThat(player.getName()).isEqualTo("Alice");
        assertThat(player.getMoney()).isEqualTo(1000);
        assertThat(player.getLevel()).isEqualTo(1);
    }

    @Test
    @DisplayName("두 번 실행 -> 예외 없음, 기존 값 유지")
    void secondRunKeepsExistingRows() {
        seedDataInitializer.seed();
        postViewService.view(POST_ID);
        postViewService.view(POST_ID);
        upgradeService.upgrade(PLAYER_ID);

        assertThatCode(() -> seedDataInitializer.seed()).doesNotThrowAnyException();

        assertThat(postViewService.getPost(POST_ID).getViews()).isEqualTo(2L);
        Player player = upgradeService.getPlayer(PLAYER_ID);
        assertThat(player.getMoney()).isEqualTo(850);
        assertThat(player.getLevel()).isEqualTo(2);
        assertThat(postRepository.count()).isEqualTo(1);
        assertThat(playerRepository.count()).isEqualTo(1);
    }
}
