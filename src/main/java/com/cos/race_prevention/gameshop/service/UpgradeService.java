package com.cos.race_prevention.gameshop.service;

import com.cos.race_prevention.gameshop.config.GameShopProperties;
import com.cos.race_prevention.gameshop.entity.Player;
import com.cos.race_prevention.gameshop.repository.PlayerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 레벨업 상점 서비스 - 조건부 원자적 UPDATE 사용
 *
 * 비관적 락 방식 (SELECT ... FOR UPDATE + 트랜잭션):
 * - 정합성은 보장되지만 같은 플레이어에 대한 요청이 전부 줄을 서서 처리됨
 *
 * 이 서비스의 방식:
 * UPDATE players SET money = money - 150, level = level + 1
 * WHERE id = ? AND money >= 150
 * - 잔액 확인과 차감이 한 문장 -> 음수 잔액 불가능
 * - 트랜잭션 동안 락을 잡고 있지 않으므로 처리량 저하 없음
 * - 변경된 행 수(0 or 1)로 성공 여부 판단
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UpgradeService {

    private final PlayerRepository playerRepository;
    private final GameShopProperties gameShopProperties;

    /**
     * 플레이어 조회
     */
    @Transactional(readOnly = true)
    public Player getPlayer(Long playerId) {
        return playerRepository.findById(playerId)
                .orElseThrow(() -> new PlayerNotFoundException(playerId));
    }

    /**
     * 레벨업 구매
     *
     * 변경된 행이 0이면 잔액 부족과 존재하지 않는 id를 구분하기 위해 존재 여부를 확인함.
     * 플레이어는 삭제되지 않으므로 이 확인은 경쟁 조건을 만들지 않음
     */
    @Transactional
    public UpgradeResult upgrade(Long playerId) {
        int cost = gameShopProperties.getUpgradeCost();
        int updated = playerRepository.upgradeIfAffordable(playerId, cost);

        if (updated == 0) {
            if (!playerRepository.existsById(playerId)) {
                throw new PlayerNotFoundException(playerId);
            }
            log.info("[upgrade] rejected: playerId={}, cost={}", playerId, cost);
            return UpgradeResult.rejected(UpgradeResult.NOT_ENOUGH_MONEY);
        }

        Player player = getPlayer(playerId);
        log.debug("[upgrade] playerId={}, money={}, level={}", playerId, player.getMoney(), player.getLevel());
        return UpgradeResult.upgraded(player);
    }
}
