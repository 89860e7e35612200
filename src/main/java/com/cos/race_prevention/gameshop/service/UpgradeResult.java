package com.cos.race_prevention.gameshop.service;

import com.cos.race_prevention.gameshop.entity.Player;

import java.util.Objects;
import java.util.function.Function;

/**
 * 업그레이드 결과: 성공(Upgraded) 또는 거절(Rejected)
 *
 * 잔액 부족은 예외가 아닌 정상 응답이므로 결과 타입으로 표현함.
 * 호출자는 fold()로 두 경우를 모두 처리해야 함
 */
public abstract class UpgradeResult {

    public static final String NOT_ENOUGH_MONEY = "Not enough money";

    private UpgradeResult() {
    }

    public static UpgradeResult upgraded(Player player) {
        return new Upgraded(player);
    }

    public static UpgradeResult rejected(String reason) {
        return new Rejected(reason);
    }

    public abstract <R> R fold(Function<Player, R> onUpgraded, Function<String, R> onRejected);

    public abstract boolean isUpgraded();

    public static final class Upgraded extends UpgradeResult {

        private final Player player;

        private Upgraded(Player player) {
            this.player = Objects.requireNonNull(player, "player");
        }

        public Player getPlayer() {
            return player;
        }

        @Override
        public <R> R fold(Function<Player, R> onUpgraded, Function<String, R> onRejected) {
            return onUpgraded.apply(player);
        }

        @Override
        public boolean isUpgraded() {
            return true;
        }
    }

    public static final class Rejected extends UpgradeResult {

        private final String reason;

        private Rejected(String reason) {
            this.reason = Objects.requireNonNull(reason, "reason");
        }

        public String getReason() {
            return reason;
        }

        @Override
        public <R> R fold(Function<Player, R> onUpgraded, Function<String, R> onRejected) {
            return onRejected.apply(reason);
        }

        @Override
        public boolean isUpgraded() {
            return false;
        }
    }
}
