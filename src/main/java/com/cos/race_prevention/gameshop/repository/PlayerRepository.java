package com.cos.race_prevention.gameshop.repository;

import com.cos.race_prevention.gameshop.entity.Player;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PlayerRepository extends JpaRepository<Player, Long> {

    /**
     * 조건부 차감 + 레벨업 (한 문장)
     *
     * 실행되는 SQL:
     * UPDATE players
     * SET money = money - ?, level = level + 1
     * WHERE id = ? AND money >= ?
     *
     * 잔액 확인(WHERE money >= cost)과 차감이 같은 UPDATE 안에서 일어나므로
     * "확인했는데 그 사이 다른 요청이 먼저 차감" 하는 틈이 없음.
     * 락을 기다린 UPDATE는 커밋된 최신 값으로 WHERE 조건을 다시 평가함
     *
     * @return 1: 성공, 0: 잔액 부족 (또는 id 없음)
     */
    @Modifying(clearAutomatically = true)
    @Query("UPDATE Player p SET p.money = p.money - :cost, p.level = p.level + 1 "
            + "WHERE p.id = :id AND p.money >= :cost")
    int upgradeIfAffordable(@Param("id") Long id, @Param("cost") int cost);
}
