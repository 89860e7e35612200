package com.cos.race_prevention.gameshop.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Persistable;

/**
 * 게임 플레이어 - 잔액(money) 차감 + 레벨업 예제용 엔티티
 *
 * 불변식: money >= 0
 * 동시에 몇 개의 업그레이드 요청이 들어와도 잔액이 음수가 되면 안 됨.
 * 그래서 잔액 확인과 차감을 애플리케이션이 아닌 DB의 단일 UPDATE 문에서 수행함
 * UPDATE players SET money = money - ?, level = level + 1
 * WHERE id = ? AND money >= ?
 */
@Entity
@Table(name = "players")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Player implements Persistable<Long> {

    @Id
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private Integer money = 0;

    @Column(nullable = false)
    private Integer level = 1;

    @Transient
    @Getter(AccessLevel.NONE)
    private boolean newEntity = true;

    public Player(Long id, String name, Integer money, Integer level) {
        this.id = id;
        this.name = name;
        this.money = money;
        this.level = level;
    }

    @Override
    public boolean isNew() {
        return newEntity;
    }

    @PostLoad
    @PostPersist
    void markNotNew() {
        this.newEntity = false;
    }
}
